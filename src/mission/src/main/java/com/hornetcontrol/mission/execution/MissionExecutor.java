package com.hornetcontrol.mission.execution;

import com.hornetcontrol.mission.client.FleetRepositionClient;
import com.hornetcontrol.mission.client.RepositionRequest;
import com.hornetcontrol.mission.config.MissionProperties;
import com.hornetcontrol.mission.geometry.CoordinateProjection;
import com.hornetcontrol.mission.geometry.HexagonalFormation;
import com.hornetcontrol.mission.geometry.Position;
import com.hornetcontrol.mission.model.Mission;
import com.hornetcontrol.mission.model.MissionRunStatus;
import com.hornetcontrol.mission.model.Waypoint;
import com.hornetcontrol.mission.protocol.Command;
import com.hornetcontrol.mission.protocol.CommandSender;
import com.hornetcontrol.mission.protocol.TransportException;
import com.hornetcontrol.mission.relay.FleetView;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Mission execution orchestrator.
 *
 * <p>Drives the target vehicles through teleport, arm, takeoff, formation assembly, waypoint
 * traversal and landing. Commands are fire-and-forget; each phase ends when the
 * {@link PhaseCompletionSignal} says so. One run at a time: a second request while a run is
 * active is rejected before anything is dispatched.
 *
 * <p>Runs started with {@link #start} execute on a dedicated daemon thread.
 */
@Component
public class MissionExecutor {
  private static final Logger log = LoggerFactory.getLogger(MissionExecutor.class);
  public static final int MAX_VEHICLES = HexagonalFormation.SLOTS;

  private final CommandSender commandSender;
  private final FleetRepositionClient repositionClient;
  private final FleetView fleetView;
  private final CoordinateProjection projection;
  private final SlotAssignmentStrategy slotAssignment;
  private final PhaseCompletionSignal phaseCompletion;
  private final Sleeper sleeper;
  private final MissionLog missionLog;
  private final MissionProperties properties;
  private final Clock clock;
  private final MeterRegistry meterRegistry;
  private final Counter dispatchedCounter;
  private final Counter failedCounter;
  private final ExecutorService executor;

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final AtomicLong dispatchedCommands = new AtomicLong();
  private final AtomicLong failedCommands = new AtomicLong();
  private final AtomicLong lastTimestamp = new AtomicLong();
  private volatile MissionPhase phase = MissionPhase.IDLE;
  private volatile String missionId;
  private volatile List<String> vehicleIds = List.of();
  private volatile String lastError;
  private volatile Instant startedAt;
  private volatile Instant finishedAt;
  private volatile CancellationToken cancellationToken;

  public MissionExecutor(
      CommandSender commandSender,
      FleetRepositionClient repositionClient,
      FleetView fleetView,
      CoordinateProjection projection,
      SlotAssignmentStrategy slotAssignment,
      PhaseCompletionSignal phaseCompletion,
      Sleeper sleeper,
      MissionLog missionLog,
      MissionProperties properties,
      Clock clock,
      MeterRegistry meterRegistry) {
    this.commandSender = commandSender;
    this.repositionClient = repositionClient;
    this.fleetView = fleetView;
    this.projection = projection;
    this.slotAssignment = slotAssignment;
    this.phaseCompletion = phaseCompletion;
    this.sleeper = sleeper;
    this.missionLog = missionLog;
    this.properties = properties;
    this.clock = clock;
    this.meterRegistry = meterRegistry;
    this.dispatchedCounter = meterRegistry.counter("mission.commands.dispatched");
    this.failedCounter = meterRegistry.counter("mission.commands.failed");
    meterRegistry.gauge("mission.phase", this, orchestrator -> orchestrator.phase.ordinal());
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "mission-executor");
      thread.setDaemon(true);
      return thread;
    });
  }

  @jakarta.annotation.PreDestroy
  public void stop() {
    CancellationToken token = cancellationToken;
    if (token != null) {
      token.cancel();
    }
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Starts a run on the executor thread.
   *
   * @param mission mission definition
   * @param targets 1 to 6 distinct vehicle ids
   * @return future completed with the run outcome
   * @throws IllegalArgumentException when the target set is invalid
   * @throws MissionAlreadyRunningException when a run is active
   */
  public CompletableFuture<MissionRunResult> start(Mission mission, List<String> targets) {
    rejectIfRunning();
    List<String> validated = validate(mission, targets);
    CancellationToken token = acquire(mission, validated);
    try {
      return CompletableFuture.supplyAsync(() -> execute(mission, validated, token), executor);
    } catch (RejectedExecutionException ex) {
      finish(MissionPhase.FAILED, "mission executor is shut down");
      throw new IllegalStateException("mission executor is shut down", ex);
    }
  }

  /**
   * Runs a mission on the calling thread.
   *
   * @see #start(Mission, List)
   */
  public MissionRunResult run(Mission mission, List<String> targets) {
    rejectIfRunning();
    List<String> validated = validate(mission, targets);
    CancellationToken token = acquire(mission, validated);
    return execute(mission, validated, token);
  }

  /**
   * Cancels the active run. Pending waits end immediately and no further commands are sent.
   *
   * @return {@code false} when no run is active
   */
  public boolean cancel() {
    CancellationToken token = cancellationToken;
    if (!running.get() || token == null) {
      return false;
    }
    token.cancel();
    missionLog.warning("Mission " + missionId + " cancellation requested");
    return true;
  }

  public boolean isRunning() {
    return running.get();
  }

  public MissionPhase phase() {
    return phase;
  }

  public long dispatchedCommands() {
    return dispatchedCommands.get();
  }

  public MissionRunStatus status() {
    Instant started = startedAt;
    Instant finished = finishedAt;
    return new MissionRunStatus(
        phase,
        missionId,
        vehicleIds,
        dispatchedCommands.get(),
        failedCommands.get(),
        lastError,
        started == null ? null : started.toString(),
        finished == null ? null : finished.toString(),
        running.get());
  }

  static List<String> validateTargets(List<String> targets) {
    if (targets == null || targets.isEmpty()) {
      throw new IllegalArgumentException("at least one target vehicle is required");
    }
    if (targets.size() > MAX_VEHICLES) {
      throw new IllegalArgumentException(
          "at most " + MAX_VEHICLES + " vehicles fit into the formation, got " + targets.size());
    }
    Set<String> seen = new HashSet<>();
    for (String id : targets) {
      if (id == null || id.isBlank()) {
        throw new IllegalArgumentException("vehicle ids must not be blank");
      }
      if (!seen.add(id)) {
        throw new IllegalArgumentException("duplicate vehicle id: " + id);
      }
    }
    return List.copyOf(targets);
  }

  private static List<String> validate(Mission mission, List<String> targets) {
    if (mission == null) {
      throw new IllegalArgumentException("mission is required");
    }
    return validateTargets(targets);
  }

  private void rejectIfRunning() {
    if (running.get()) {
      throw new MissionAlreadyRunningException("mission " + missionId + " is already running");
    }
  }

  private CancellationToken acquire(Mission mission, List<String> targets) {
    if (!running.compareAndSet(false, true)) {
      throw new MissionAlreadyRunningException("mission " + missionId + " is already running");
    }
    CancellationToken token = new CancellationToken();
    cancellationToken = token;
    missionId = mission.id();
    vehicleIds = targets;
    dispatchedCommands.set(0);
    failedCommands.set(0);
    lastError = null;
    startedAt = clock.instant();
    finishedAt = null;
    phase = MissionPhase.IDLE;
    return token;
  }

  private MissionRunResult execute(Mission mission, List<String> targets, CancellationToken token) {
    missionLog.info("Mission " + mission.id() + " started with " + String.join(", ", targets));
    try {
      List<Position> path = projectPath(mission);
      reportUnknownVehicles(targets);
      MissionProperties.Timing timing = properties.timing();
      double altitude = properties.flight().initialAltitude();

      enter(MissionPhase.TELEPORT_TO_ORIGIN);
      teleportToOrigin(mission);

      enter(MissionPhase.ARM_ALL);
      dispatchToAll(targets, id -> Command.arm(id, nextTimestamp()), token);
      settle(MissionPhase.ARM_ALL, targets, timing.armSettle(), token);

      enter(MissionPhase.TAKEOFF_ALL);
      dispatchToAll(targets, id -> Command.takeoff(id, altitude, nextTimestamp()), token);
      settle(MissionPhase.TAKEOFF_ALL, targets, timing.takeoffSettle(), token);

      enter(MissionPhase.ASSEMBLE_FORMATION);
      flyFormation(targets, path.get(0).withZ(altitude), timing.commandStagger(), token);
      settle(MissionPhase.ASSEMBLE_FORMATION, targets, timing.formationSettle(), token);

      enter(MissionPhase.TRAVERSE_WAYPOINTS);
      int count = path.size();
      for (int i = 1; i < count; i++) {
        double waypointAltitude = AltitudeProfile.altitudeAt(altitude, i, count);
        missionLog.info(String.format(Locale.ROOT, "Waypoint %d/%d at %.1fm", i, count - 1, waypointAltitude));
        flyFormation(targets, path.get(i).withZ(waypointAltitude), timing.waypointStagger(), token);
        settle(MissionPhase.TRAVERSE_WAYPOINTS, targets, timing.waypointSettle(), token);
      }

      enter(MissionPhase.LAND_ALL);
      dispatchToAll(targets, id -> Command.land(id, nextTimestamp()), token);
      settle(MissionPhase.LAND_ALL, targets, timing.landSettle(), token);

      return finish(MissionPhase.COMPLETE, null);
    } catch (MissionCancelledException ex) {
      return finish(MissionPhase.CANCELLED, ex.getMessage());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return finish(MissionPhase.CANCELLED, "mission run interrupted");
    } catch (Exception ex) {
      log.error("Mission {} aborted in phase {}", mission.id(), phase, ex);
      return finish(MissionPhase.FAILED, ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
    }
  }

  private List<Position> projectPath(Mission mission) {
    List<Waypoint> waypoints = mission.path();
    if (waypoints.isEmpty()) {
      throw new MissionAbortException("mission " + mission.id() + " has no waypoints");
    }
    List<Position> path = new ArrayList<>(waypoints.size());
    for (int i = 0; i < waypoints.size(); i++) {
      try {
        path.add(projection.toPlanar(waypoints.get(i)));
      } catch (IllegalArgumentException ex) {
        throw new MissionAbortException("waypoint " + i + ": " + ex.getMessage(), ex);
      }
    }
    return path;
  }

  private void reportUnknownVehicles(List<String> targets) {
    List<String> unknown = targets.stream().filter(id -> !fleetView.isKnown(id)).toList();
    if (!unknown.isEmpty()) {
      missionLog.warning("Vehicles not in fleet view: " + String.join(", ", unknown));
    }
  }

  private void teleportToOrigin(Mission mission) {
    Position origin;
    try {
      origin = projection.toPlanar(mission.origin());
    } catch (IllegalArgumentException ex) {
      missionLog.warning("Skipping teleport: mission origin unusable (" + ex.getMessage() + ")");
      return;
    }
    boolean moved = repositionClient.reposition(
        RepositionRequest.circle(origin.x(), origin.y(), properties.flight().teleportRadius()));
    if (moved) {
      missionLog.info(String.format(Locale.ROOT, "Teleported fleet to origin (%.1f, %.1f)", origin.x(), origin.y()));
    } else {
      missionLog.warning("Teleport to origin failed, continuing from current positions");
    }
  }

  private void flyFormation(List<String> targets, Position center, Duration stagger, CancellationToken token)
      throws InterruptedException {
    List<Position> slots = HexagonalFormation.positions(center, properties.formation().radius());
    Map<String, Position> assignment = slotAssignment.assign(targets, slots, fleetView.snapshot());
    dispatchToAll(targets, id -> {
      Position slot = assignment.get(id);
      return Command.goTo(id, slot.x(), slot.y(), slot.z(), nextTimestamp());
    }, stagger, token);
  }

  private void dispatchToAll(List<String> targets, Function<String, Command> factory, CancellationToken token)
      throws InterruptedException {
    dispatchToAll(targets, factory, properties.timing().commandStagger(), token);
  }

  private void dispatchToAll(
      List<String> targets,
      Function<String, Command> factory,
      Duration stagger,
      CancellationToken token) throws InterruptedException {
    for (int i = 0; i < targets.size(); i++) {
      if (i > 0) {
        sleeper.sleep(stagger, token);
      }
      token.throwIfCancelled();
      dispatch(factory.apply(targets.get(i)));
    }
  }

  private void dispatch(Command command) {
    try {
      commandSender.send(command);
      dispatchedCommands.incrementAndGet();
      dispatchedCounter.increment();
    } catch (TransportException ex) {
      failedCommands.incrementAndGet();
      failedCounter.increment();
      missionLog.warning("[" + command.targetId() + "] " + command.command().wireName()
          + " not sent: " + ex.getMessage());
    }
  }

  private void settle(MissionPhase current, List<String> targets, Duration window, CancellationToken token)
      throws InterruptedException {
    phaseCompletion.awaitCompletion(current, targets, window, token);
  }

  private long nextTimestamp() {
    long now = clock.millis();
    return lastTimestamp.updateAndGet(last -> Math.max(now, last + 1));
  }

  private void enter(MissionPhase next) {
    phase = next;
    missionLog.info("Phase " + next.name());
  }

  private MissionRunResult finish(MissionPhase outcome, String message) {
    phase = outcome;
    finishedAt = clock.instant();
    long dispatched = dispatchedCommands.get();
    switch (outcome) {
      case COMPLETE -> missionLog.info("Mission " + missionId + " complete (" + dispatched + " commands)");
      case CANCELLED -> missionLog.warning("Mission " + missionId + " cancelled: " + message);
      default -> {
        lastError = message;
        missionLog.error("Mission " + missionId + " failed: " + message);
      }
    }
    Counter.builder("mission.runs")
        .description("Mission runs (by outcome)")
        .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
        .register(meterRegistry)
        .increment();
    running.set(false);
    return new MissionRunResult(outcome, message, dispatched);
  }
}
