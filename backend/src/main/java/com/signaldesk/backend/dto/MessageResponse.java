package com.signaldesk.backend.dto;

public record MessageResponse(String message) {}
