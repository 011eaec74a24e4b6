package com.carecore.engine.clock;

import com.carecore.engine.EngineSettings;
import com.carecore.engine.EngineUnit;
import com.carecore.engine.agent.AgentRuntime;
import com.carecore.engine.bus.MessageBus;
import com.carecore.engine.event.LabResultEvent;
import com.carecore.engine.event.MedicationChangeEvent;
import com.carecore.engine.event.ProducerSequence;
import com.carecore.engine.event.VitalUpdateEvent;
import com.carecore.engine.feed.DataFeed;
import com.carecore.engine.metrics.MetricsAggregator;
import com.carecore.engine.model.LabResult;
import com.carecore.engine.model.MedicationChange;
import com.carecore.engine.model.PatientAdmission;
import com.carecore.engine.model.VitalSigns;
import com.carecore.engine.run.RunStatus;
import com.carecore.engine.run.RunSummary;
import com.carecore.engine.run.SimulationRun;
import com.carecore.engine.store.PatientStateStore;
import com.carecore.eventmodel.EventEntity;
import com.carecore.eventmodel.EventEnvelope;
import com.carecore.eventmodel.EventFactory;
import com.carecore.eventmodel.EventType;
import com.carecore.observability.CorrelationContext;
import com.carecore.observability.CorrelationContextHolder;
import com.carecore.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives a run in discrete ticks.
 *
 * <p>Lifecycle: {@code IDLE -> RUNNING -> COMPLETED}, or {@code FAILED} when setup fails. Setup
 * admits the census and starts one thread per engine unit. Each tick feeds every patient, then
 * waits on a soft barrier (pending work across units at most the threshold, or the barrier
 * timeout) and sleeps out the rest of the tick interval. At the end the clock waits for the units
 * to drain, closes the bus, joins the unit threads and finalizes the metrics.
 *
 * <p>The clock's own publishes are bounded by the run deadline, a stop request and the drain
 * timeout. If a subscriber queue stays full past that bound the bus is treated as stalled: the
 * run ends early and the bus is closed, which releases every unit blocked on a full queue.
 *
 * <p>A clock runs exactly once.
 */
public final class SimulationClock {

    private static final Logger log = LoggerFactory.getLogger(SimulationClock.class);

    public static final String PRODUCER = "clock";
    private static final long BARRIER_POLL_MILLIS = 2;

    private final SimulationRun run;
    private final EngineSettings settings;
    private final PatientStateStore store;
    private final MessageBus bus;
    private final DataFeed feed;
    private final List<EngineUnit> units;
    private final MetricsAggregator aggregator;
    private final Pacer pacer;
    private final ProducerSequence sequence = new ProducerSequence();
    private final AtomicBoolean used = new AtomicBoolean();
    private final Counter tickCounter;
    private final Counter barrierTimeoutCounter;
    private final Counter stallCounter;
    private volatile boolean stopRequested;
    private volatile Instant deadline = Instant.MAX;

    public SimulationClock(SimulationRun run, EngineSettings settings, PatientStateStore store, MessageBus bus,
                           DataFeed feed, List<EngineUnit> units, MetricsAggregator aggregator, Pacer pacer,
                           MetricFactory metrics) {
        this.run = run;
        this.settings = settings;
        this.store = store;
        this.bus = bus;
        this.feed = feed;
        this.units = List.copyOf(units);
        this.aggregator = aggregator;
        this.pacer = pacer;
        this.tickCounter = metrics.counter("icu.clock.ticks", "Ticks executed");
        this.barrierTimeoutCounter = metrics.counter("icu.clock.barrier.timeouts",
                "Ticks whose soft barrier timed out");
        this.stallCounter = metrics.counter("icu.clock.publish.stalls",
                "Runs ended early because the bus stayed full");
    }

    public RunStatus status() {
        return run.status();
    }

    /** Runs the simulation on a new "simulation-clock" thread. */
    public CompletableFuture<RunSummary> start() {
        CompletableFuture<RunSummary> result = new CompletableFuture<>();
        Thread thread = new Thread(() -> {
            try {
                result.complete(run());
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        }, "simulation-clock");
        thread.start();
        return result;
    }

    /** Ends the run after the current tick. The run still completes normally. */
    public void requestStop() {
        stopRequested = true;
    }

    /**
     * Runs the simulation on the calling thread and returns its summary.
     *
     * @throws IllegalStateException if this clock has already been started
     */
    public RunSummary run() {
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException("Simulation clock of run " + run.runId() + " is single use");
        }
        CorrelationContextHolder.set(CorrelationContext.forUnit(run.runId(), PRODUCER));
        try {
            List<Thread> threads;
            try {
                threads = setUp();
            } catch (SetupFailureException e) {
                log.error("Run {} failed during setup", run.runId(), e);
                run.markFailed(pacer.now(), e.getMessage());
                bus.close();
                return aggregator.finalizeRun();
            }
            run.markRunning(pacer.now());
            log.info("Run {} started: {} patients, {} units, {} ticks of {}", run.runId(), store.size(),
                    units.size(), settings.tickCount(), settings.tickInterval());
            boolean interrupted = false;
            try {
                if (executeTicks()) {
                    awaitPendingAtMost(0, settings.drainTimeout());
                }
            } catch (InterruptedException e) {
                interrupted = true;
                log.warn("Run {} interrupted after {} ticks, stopping", run.runId(), run.ticksExecuted());
            }
            bus.close();
            joinUnits(threads, interrupted);
            run.markCompleted(pacer.now());
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
            return aggregator.finalizeRun();
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    private List<Thread> setUp() {
        List<PatientAdmission> admissions;
        try {
            admissions = feed.admissions();
        } catch (RuntimeException e) {
            throw new SetupFailureException("Data feed could not provide the census", e);
        }
        if (admissions == null || admissions.isEmpty()) {
            throw new SetupFailureException("Census is empty");
        }
        for (PatientAdmission admission : admissions) {
            try {
                store.admit(admission.patientId(), admission.demographics());
            } catch (RuntimeException e) {
                throw new SetupFailureException("Could not admit patient " + admission.patientId(), e);
            }
        }
        if (bus.isClosed()) {
            throw new SetupFailureException("Message bus is closed");
        }
        int agents = (int) units.stream().filter(AgentRuntime.class::isInstance).count();
        run.setCensus(store.size(), agents);

        List<Thread> threads = new ArrayList<>(units.size());
        try {
            for (EngineUnit unit : units) {
                Thread thread = new Thread(unit, unit.name());
                thread.start();
                threads.add(thread);
            }
        } catch (RuntimeException e) {
            bus.close();
            throw new SetupFailureException("Could not start engine units", e);
        }
        return threads;
    }

    /** Runs the ticks; false when the run ended on a stalled bus. */
    private boolean executeTicks() throws InterruptedException {
        long tickCount = settings.tickCount();
        deadline = pacer.now().plus(settings.duration());
        for (long tick = 1; tick <= tickCount && !stopRequested; tick++) {
            Instant tickStart = pacer.now();
            if (!tickStart.isBefore(deadline)) {
                log.info("Run {} reached its wall-clock bound after {} ticks", run.runId(), tick - 1);
                break;
            }
            try {
                runTick(tick);
            } catch (BusStalledException e) {
                stallCounter.increment();
                log.warn("Run {} ending in tick {}: {}", run.runId(), tick, e.getMessage());
                return false;
            }
            run.recordTick();
            tickCounter.increment();
            if (!awaitPendingAtMost(settings.backlogThreshold(), settings.barrierTimeout())) {
                barrierTimeoutCounter.increment();
                log.debug("Soft barrier timed out in tick {} with {} pending", tick, pendingWork());
            }
            Duration remaining = settings.tickInterval().minus(Duration.between(tickStart, pacer.now()));
            pacer.sleep(remaining);
        }
        return true;
    }

    /** Feeds every patient once. A failure for one patient skips only that patient. */
    void runTick(long tick) throws InterruptedException {
        for (String patientId : store.patientIds()) {
            try {
                feedPatient(patientId, tick);
            } catch (BusStalledException e) {
                throw e;
            } catch (RuntimeException e) {
                run.recordFeedFailure();
                log.warn("Data feed failed for patient {} in tick {}", patientId, tick, e);
            }
        }
    }

    private void feedPatient(String patientId, long tick) throws InterruptedException {
        VitalSigns vitals = feed.generateVitals(patientId);
        store.applyVitalUpdate(patientId, vitals);
        Instant measuredAt = vitals.latestMeasuredAt().orElseGet(pacer::now);
        publish(EventFactory.create(EventType.VITALS_UPDATED, PRODUCER, run.runId(),
                EventEntity.patient(patientId, sequence.next()), tick, measuredAt,
                new VitalUpdateEvent(patientId, vitals, measuredAt)));

        Optional<LabResult> lab = feed.generateLab(patientId);
        if (lab.isPresent()) {
            store.applyLabResult(patientId, lab.get());
            publish(EventFactory.create(EventType.LAB_RESULTED, PRODUCER, run.runId(),
                    EventEntity.patient(patientId, sequence.next()), tick, lab.get().resultedAt(),
                    new LabResultEvent(patientId, lab.get())));
        }

        for (MedicationChange change : feed.generateMedicationChanges(patientId)) {
            store.applyMedicationChange(patientId, change);
            publish(EventFactory.create(EventType.MEDICATION_CHANGED, PRODUCER, run.runId(),
                    EventEntity.patient(patientId, sequence.next()), tick, measuredAt,
                    new MedicationChangeEvent(patientId, change, MedicationChangeEvent.FEED_SOURCE)));
        }
    }

    private void publish(EventEnvelope<?> event) throws InterruptedException {
        if (!bus.tryPublish(event, settings.drainTimeout(), this::shouldStopPublishing)) {
            throw new BusStalledException(event.eventType() + " for " + event.entityId()
                    + " not delivered: " + stallReason());
        }
    }

    private String stallReason() {
        if (stopRequested) {
            return "stop requested";
        }
        if (!pacer.now().isBefore(deadline)) {
            return "run deadline passed";
        }
        return "no queue space within " + settings.drainTimeout();
    }

    private boolean shouldStopPublishing() {
        return stopRequested || !pacer.now().isBefore(deadline);
    }

    private boolean awaitPendingAtMost(int threshold, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (pendingWork() > threshold) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            Thread.sleep(BARRIER_POLL_MILLIS);
        }
        return true;
    }

    private int pendingWork() {
        int pending = 0;
        for (EngineUnit unit : units) {
            pending += unit.pending();
        }
        return pending;
    }

    private void joinUnits(List<Thread> threads, boolean interrupted) {
        long deadline = System.nanoTime() + settings.drainTimeout().toNanos();
        for (Thread thread : threads) {
            if (interrupted) {
                thread.interrupt();
            }
            try {
                long remaining = Math.max(1, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime()));
                thread.join(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for {} to stop", thread.getName());
                return;
            }
            if (thread.isAlive()) {
                log.warn("Unit {} did not drain within {}, interrupting", thread.getName(), settings.drainTimeout());
                thread.interrupt();
            }
        }
    }

    /** A clock publish could not be delivered in time. Ends the run; never per-patient. */
    private static final class BusStalledException extends RuntimeException {

        BusStalledException(String message) {
            super(message);
        }
    }
}
