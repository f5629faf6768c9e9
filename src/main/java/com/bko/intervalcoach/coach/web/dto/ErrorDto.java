package com.bko.intervalcoach.coach.web.dto;

public record ErrorDto(int status, String error, String message) { }
