package com.rostermate.backend.modules.assignment.presentation.dto;

public record UnassignResponse(boolean removed) {
}
