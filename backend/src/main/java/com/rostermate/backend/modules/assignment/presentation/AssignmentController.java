package com.rostermate.backend.modules.assignment.presentation;

import java.util.UUID;

import com.rostermate.backend.global.error.ProblemException;
import com.rostermate.backend.modules.assignment.application.RoleAssignmentEngine;
import com.rostermate.backend.modules.assignment.domain.AssignmentDecision;
import com.rostermate.backend.modules.assignment.presentation.dto.AssignRoleRequest;
import com.rostermate.backend.modules.assignment.presentation.dto.AssignmentResponse;
import com.rostermate.backend.modules.assignment.presentation.dto.UnassignResponse;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/events/{eventId}")
public class AssignmentController {

    private final RoleAssignmentEngine roleAssignmentEngine;

    public AssignmentController(RoleAssignmentEngine roleAssignmentEngine) {
        this.roleAssignmentEngine = roleAssignmentEngine;
    }

    @Operation(
            summary = "Sign a volunteer up for a role",
            description = """
                    Commits the assignment when the role exists, the volunteer does not already hold it, \
                    a unique role is still free and no held role shares an exclusion group with it. \
                    Otherwise the decline code is returned in `code`.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Assignment committed"),
            @ApiResponse(responseCode = "404", description = "`ROLE_NOT_FOUND`, `EVENT_NOT_FOUND` or `VOLUNTEER_NOT_FOUND`"),
            @ApiResponse(responseCode = "409", description = "`ALREADY_ASSIGNED_SAME_ROLE`, `ROLE_TAKEN` or `EXCLUSION_CONFLICT`"),
            @ApiResponse(responseCode = "503", description = "`STORE_UNAVAILABLE`, retry after the `Retry-After` delay")
    })
    @PostMapping("/assignments")
    public ResponseEntity<AssignmentResponse> assign(
            @PathVariable("eventId") UUID eventId,
            @Valid @RequestBody AssignRoleRequest request
    ) {
        AssignmentDecision decision = roleAssignmentEngine.assign(request.volunteerId(), eventId, request.roleName());
        if (!decision.ok()) {
            throw toProblem(decision);
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(new AssignmentResponse(
                eventId,
                request.volunteerId(),
                decision.roleCode(),
                decision.roleName(),
                decision.message()
        ));
    }

    @DeleteMapping("/volunteers/{volunteerId}/assignments")
    public ResponseEntity<UnassignResponse> unassign(
            @PathVariable("eventId") UUID eventId,
            @PathVariable("volunteerId") long volunteerId
    ) {
        return ResponseEntity.ok(new UnassignResponse(roleAssignmentEngine.unassign(volunteerId, eventId)));
    }

    private ProblemException toProblem(AssignmentDecision decision) {
        HttpStatus status = switch (decision.reason()) {
            case ROLE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ALREADY_ASSIGNED_SAME_ROLE, ROLE_TAKEN, EXCLUSION_CONFLICT -> HttpStatus.CONFLICT;
        };
        return new ProblemException(status, decision.reason().name(), decision.message());
    }
}
