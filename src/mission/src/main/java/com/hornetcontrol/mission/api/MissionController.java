package com.hornetcontrol.mission.api;

import com.hornetcontrol.mission.execution.MissionLog;
import com.hornetcontrol.mission.execution.MissionLogEntry;
import com.hornetcontrol.mission.model.MissionRunRequest;
import com.hornetcontrol.mission.model.MissionRunStatus;
import com.hornetcontrol.mission.service.MissionService;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for mission runs.
 *
 * <p>Route design:
 * <ul>
 *   <li>{@code POST /api/missions/{missionId}/run}: starts a run, 202</li>
 *   <li>{@code GET /api/missions/status}: current or last run</li>
 *   <li>{@code POST /api/missions/cancel}: cancels the active run, 202</li>
 *   <li>{@code GET /api/missions/log}: rolling mission log</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/missions")
public class MissionController {
  private final MissionService missionService;
  private final MissionLog missionLog;

  public MissionController(MissionService missionService, MissionLog missionLog) {
    this.missionService = missionService;
    this.missionLog = missionLog;
  }

  @PostMapping("/{missionId}/run")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public MissionRunStatus run(
      @PathVariable("missionId") String missionId,
      @RequestBody MissionRunRequest request) {
    return missionService.startRun(missionId, request);
  }

  @GetMapping("/status")
  public MissionRunStatus status() {
    return missionService.status();
  }

  @PostMapping("/cancel")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public MissionRunStatus cancel() {
    return missionService.cancel();
  }

  @GetMapping("/log")
  public List<MissionLogEntry> log() {
    return missionLog.entries();
  }
}
