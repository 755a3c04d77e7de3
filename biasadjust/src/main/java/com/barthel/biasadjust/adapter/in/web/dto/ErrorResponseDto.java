package com.barthel.biasadjust.adapter.in.web.dto;

public record ErrorResponseDto(String error, String message) {}
