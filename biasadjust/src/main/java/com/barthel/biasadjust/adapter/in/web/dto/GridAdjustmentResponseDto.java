package com.barthel.biasadjust.adapter.in.web.dto;

import java.util.Map;

public record GridAdjustmentResponseDto(String method, double[][][] values, Map<String, String> attributes) {}
