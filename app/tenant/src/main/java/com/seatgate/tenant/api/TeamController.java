package com.seatgate.tenant.api;

import com.seatgate.tenant.api.request.TeamPlanRequest;
import com.seatgate.tenant.api.request.TeamRenameRequest;
import com.seatgate.tenant.api.response.TeamResponse;
import com.seatgate.tenant.service.TeamService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/teams")
@RequiredArgsConstructor
public class TeamController {

  private final TeamService teamService;

  @GetMapping("/{teamId}")
  public TeamResponse getTeam(@PathVariable String teamId) {
    return TeamResponse.from(teamService.getTeam(teamId));
  }

  @PatchMapping("/{teamId}")
  public TeamResponse rename(@PathVariable String teamId, @RequestBody TeamRenameRequest request) {
    return TeamResponse.from(teamService.rename(teamId, request.name()));
  }

  @PutMapping("/{teamId}/plan")
  public TeamResponse updatePlan(
      @PathVariable String teamId, @RequestBody TeamPlanRequest request) {
    return TeamResponse.from(teamService.updatePlan(teamId, request.plan()));
  }
}
