package com.carecore.simulator.feed;

import com.carecore.engine.feed.DataFeed;
import com.carecore.engine.model.Demographics;
import com.carecore.engine.model.LabResult;
import com.carecore.engine.model.Medication;
import com.carecore.engine.model.MedicationChange;
import com.carecore.engine.model.PatientAdmission;
import com.carecore.engine.model.VitalSign;
import com.carecore.engine.model.VitalSigns;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Randomized ICU census and monitoring data.
 *
 * <p>Vitals drift from the previous reading by up to 10% of the normal range per tick and are
 * clamped to [0.7 x min, 1.3 x max]. Critical patients jump around a wider band instead. Labs
 * result at a configurable rate per patient and tick, 80% of them inside the reference range.
 * Every patient is started on two medications on the first tick.
 *
 * <p>All randomness comes from one {@link Random}, so a fixed seed reproduces a run as long as
 * the feed is called in the same order, which the clock guarantees.
 */
public final class SyntheticDataFeed implements DataFeed {

    private static final Logger log = LoggerFactory.getLogger(SyntheticDataFeed.class);

    /** Default probability that a patient gets a lab result on a given tick. */
    public static final double DEFAULT_LAB_PROBABILITY = 0.1;

    static final Map<VitalSign, Range> VITAL_RANGES = vitalRanges();
    static final Map<String, LabRange> LAB_RANGES = labRanges();
    static final List<MedicationTemplate> MEDICATIONS = List.of(
            new MedicationTemplate("Norepinephrine", 0.1, 2.0, "mcg/kg/min"),
            new MedicationTemplate("Propofol", 10, 50, "mcg/kg/min"),
            new MedicationTemplate("Fentanyl", 0.5, 5.0, "mcg/kg/hr"),
            new MedicationTemplate("Midazolam", 0.02, 0.1, "mg/kg/hr"),
            new MedicationTemplate("Furosemide", 20, 80, "mg"));

    private static final List<String> CONDITIONS = List.of(
            "Sepsis", "Pneumonia", "ARDS", "Heart Failure", "Diabetic Ketoacidosis",
            "Post-operative monitoring", "Trauma", "Stroke", "Myocardial Infarction");
    private static final List<String> ACUITIES = List.of("stable", "moderate", "critical");
    private static final List<List<String>> ALLERGIES = List.of(
            List.of(), List.of("Penicillin"), List.of("Latex"), List.of("Contrast"));
    private static final List<List<String>> HISTORIES = List.of(
            List.of("Hypertension"), List.of("Diabetes", "Hypertension"), List.of("COPD"), List.of());
    private static final List<String> FIRST_NAMES = List.of("John", "Jane", "Alice", "Bob", "Carol");
    private static final List<String> LAST_NAMES = List.of("Smith", "Johnson", "Williams", "Brown", "Jones");
    private static final int MEDICATIONS_PER_PATIENT = 2;

    private final Random random;
    private final int patientCount;
    private final double labProbability;
    private final Supplier<Instant> time;
    private final Map<String, String> acuityByPatient = new HashMap<>();
    private final Map<String, EnumMap<VitalSign, Double>> lastValues = new HashMap<>();
    private final Set<String> medicated = new HashSet<>();
    private List<PatientAdmission> admissions;
    private long medicationSequence;

    /**
     * @param patientCount   number of patients to admit
     * @param seed           random seed, or null for a non-reproducible feed
     * @param labProbability chance per patient and tick of a lab result, in [0, 1]
     * @param time           source of measurement times, normally the run's pacer
     */
    public SyntheticDataFeed(int patientCount, Long seed, double labProbability, Supplier<Instant> time) {
        if (patientCount < 0) {
            throw new IllegalArgumentException("patientCount must not be negative");
        }
        if (labProbability < 0 || labProbability > 1) {
            throw new IllegalArgumentException("labProbability must be between 0 and 1");
        }
        if (time == null) {
            throw new IllegalArgumentException("time must not be null");
        }
        this.patientCount = patientCount;
        this.random = seed == null ? new Random() : new Random(seed);
        this.labProbability = labProbability;
        this.time = time;
    }

    @Override
    public synchronized List<PatientAdmission> admissions() {
        if (admissions == null) {
            List<PatientAdmission> generated = new ArrayList<>(patientCount);
            for (int i = 1; i <= patientCount; i++) {
                generated.add(generatePatient(String.format("PATIENT_%04d", i)));
            }
            admissions = Collections.unmodifiableList(generated);
            log.info("Generated census of {} patients", patientCount);
        }
        return admissions;
    }

    @Override
    public synchronized VitalSigns generateVitals(String patientId) {
        boolean critical = "critical".equals(acuityByPatient.get(patientId));
        EnumMap<VitalSign, Double> previous = lastValues.get(patientId);
        EnumMap<VitalSign, Double> values = new EnumMap<>(VitalSign.class);

        for (Map.Entry<VitalSign, Range> entry : VITAL_RANGES.entrySet()) {
            VitalSign sign = entry.getKey();
            Range range = entry.getValue();
            double value;
            if (critical) {
                value = switch (sign) {
                    case HEART_RATE -> uniform(50, 150);
                    case SYSTOLIC_BP -> uniform(70, 180);
                    case SPO2 -> uniform(88, 98);
                    default -> uniform(range.min() * 0.8, range.max() * 1.2);
                };
            } else if (previous != null && previous.containsKey(sign)) {
                double change = uniform(-0.1, 0.1) * (range.max() - range.min());
                value = clamp(previous.get(sign) + change, range.min() * 0.7, range.max() * 1.3);
            } else {
                value = uniform(range.min(), range.max());
            }
            values.put(sign, sign == VitalSign.TEMPERATURE ? round(value, 1) : round(value, 0));
        }

        lastValues.put(patientId, values);
        return VitalSigns.of(time.get(), values);
    }

    @Override
    public synchronized Optional<LabResult> generateLab(String patientId) {
        if (random.nextDouble() >= labProbability) {
            return Optional.empty();
        }
        List<String> tests = new ArrayList<>(LAB_RANGES.keySet());
        String testName = tests.get(random.nextInt(tests.size()));
        LabRange range = LAB_RANGES.get(testName);

        double value;
        if (random.nextDouble() < 0.8) {
            value = uniform(range.min(), range.max());
        } else if (random.nextDouble() < 0.5) {
            value = uniform(range.min() * 0.5, range.min() * 0.9);
        } else {
            value = uniform(range.max() * 1.1, range.max() * 1.5);
        }
        value = round(value, range.decimals());
        return Optional.of(new LabResult(testName, value, range.unit(), range.min(), range.max(), time.get()));
    }

    /** Starts two random medications on a patient's first tick, nothing afterwards. */
    @Override
    public synchronized List<MedicationChange> generateMedicationChanges(String patientId) {
        if (!medicated.add(patientId)) {
            return List.of();
        }
        List<MedicationTemplate> pool = new ArrayList<>(MEDICATIONS);
        Collections.shuffle(pool, random);
        Instant now = time.get();
        List<MedicationChange> changes = new ArrayList<>(MEDICATIONS_PER_PATIENT);
        for (MedicationTemplate template : pool.subList(0, MEDICATIONS_PER_PATIENT)) {
            Medication medication = new Medication(
                    String.format("MED_%06d", ++medicationSequence),
                    template.name(),
                    round(uniform(template.minDose(), template.maxDose()), 2),
                    template.unit(),
                    pick(List.of("IV", "PO")),
                    pick(List.of("continuous", "q4h", "q6h")),
                    now.minus(Duration.ofHours(1 + random.nextInt(24))),
                    "DR_" + (1000 + random.nextInt(9000)));
            changes.add(MedicationChange.start(medication));
        }
        return changes;
    }

    private PatientAdmission generatePatient(String patientId) {
        String acuity = pick(ACUITIES);
        acuityByPatient.put(patientId, acuity);
        Demographics demographics = new Demographics(
                "MRN" + (100000 + random.nextInt(900000)),
                pick(FIRST_NAMES),
                pick(LAST_NAMES),
                18 + random.nextInt(73),
                pick(List.of("male", "female")),
                round(uniform(50, 120), 1),
                150 + random.nextInt(51),
                time.get().minus(Duration.ofHours(1 + random.nextInt(72))),
                pick(CONDITIONS),
                acuity,
                pick(ALLERGIES),
                pick(HISTORIES));
        return new PatientAdmission(patientId, demographics);
    }

    private <T> T pick(List<T> options) {
        return options.get(random.nextInt(options.size()));
    }

    private double uniform(double min, double max) {
        return min + random.nextDouble() * (max - min);
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }

    private static Map<VitalSign, Range> vitalRanges() {
        Map<VitalSign, Range> ranges = new EnumMap<>(VitalSign.class);
        ranges.put(VitalSign.HEART_RATE, new Range(60, 100));
        ranges.put(VitalSign.SYSTOLIC_BP, new Range(90, 140));
        ranges.put(VitalSign.DIASTOLIC_BP, new Range(60, 90));
        ranges.put(VitalSign.RESPIRATORY_RATE, new Range(12, 20));
        ranges.put(VitalSign.SPO2, new Range(95, 100));
        ranges.put(VitalSign.TEMPERATURE, new Range(36.1, 37.2));
        return Collections.unmodifiableMap(ranges);
    }

    private static Map<String, LabRange> labRanges() {
        // Seeded picks index into the key order.
        Map<String, LabRange> ranges = new LinkedHashMap<>();
        ranges.put("glucose", new LabRange(70, 140, "mg/dL", 1));
        ranges.put("sodium", new LabRange(135, 145, "mEq/L", 0));
        ranges.put("potassium", new LabRange(3.5, 5.0, "mEq/L", 1));
        ranges.put("creatinine", new LabRange(0.6, 1.3, "mg/dL", 1));
        ranges.put("hemoglobin", new LabRange(12.0, 16.0, "g/dL", 1));
        return Collections.unmodifiableMap(ranges);
    }

    /** Normal range of a vital sign. */
    record Range(double min, double max) {
    }

    /** Reference range of a lab test, with the precision results are reported at. */
    record LabRange(double min, double max, String unit, int decimals) {
    }

    /** A drug the feed may start, with its dose range. */
    record MedicationTemplate(String name, double minDose, double maxDose, String unit) {
    }
}
