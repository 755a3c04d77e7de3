package com.barthel.biasadjust.adapter.in.web.controller;

import com.barthel.biasadjust.adapter.in.web.AdjustmentRequestMapper;
import com.barthel.biasadjust.adapter.in.web.dto.AdjustmentRequestDto;
import com.barthel.biasadjust.adapter.in.web.dto.AdjustmentResponseDto;
import com.barthel.biasadjust.adapter.in.web.dto.GridAdjustmentRequestDto;
import com.barthel.biasadjust.adapter.in.web.dto.GridAdjustmentResponseDto;
import com.barthel.biasadjust.application.port.in.AdjustUseCase;
import com.barthel.biasadjust.application.port.in.DetrendedQuantileMappingUseCase;
import com.barthel.biasadjust.domain.model.AdjustmentMethod;
import com.barthel.biasadjust.domain.model.AdjustmentResult;
import com.barthel.biasadjust.domain.model.GridAdjustmentResult;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/adjust")
@RequiredArgsConstructor
public class AdjustmentController {

    private final AdjustUseCase adjustUseCase;
    private final DetrendedQuantileMappingUseCase detrendedUseCase;
    private final AdjustmentRequestMapper mapper;

    @PostMapping
    public AdjustmentResponseDto adjust(@RequestBody AdjustmentRequestDto request) {
        AdjustmentMethod method = AdjustmentMethod.fromName(request.method());
        AdjustmentResult result = adjustUseCase.adjust(
                method,
                mapper.toSeries("obs", request.obs(), request.obsDates()),
                mapper.toSeries("simh", request.simh(), request.simhDates()),
                mapper.toSeries("simp", request.simp(), request.simpDates()),
                mapper.toParameters(request, method.isDistributionBased())
        );
        return new AdjustmentResponseDto(result.method().methodName(), result.values(), result.attributes());
    }

    @PostMapping("/detrended")
    public AdjustmentResponseDto adjustDetrended(@RequestBody AdjustmentRequestDto request) {
        AdjustmentResult result = detrendedUseCase.adjustDetrended(
                mapper.toSeries("obs", request.obs(), request.obsDates()),
                mapper.toSeries("simh", request.simh(), request.simhDates()),
                mapper.toSeries("simp", request.simp(), request.simpDates()),
                mapper.toParameters(request, true)
        );
        return new AdjustmentResponseDto(result.method().methodName(), result.values(), result.attributes());
    }

    @PostMapping("/grid")
    public GridAdjustmentResponseDto adjustGrid(@RequestBody GridAdjustmentRequestDto request) {
        AdjustmentMethod method = AdjustmentMethod.fromName(request.method());
        GridAdjustmentResult result = adjustUseCase.adjust(
                method,
                mapper.toGrid("obs", request.obs(), request.obsDates()),
                mapper.toGrid("simh", request.simh(), request.simhDates()),
                mapper.toGrid("simp", request.simp(), request.simpDates()),
                mapper.toParameters(request, method.isDistributionBased())
        );
        return new GridAdjustmentResponseDto(result.method().methodName(), result.values(), result.attributes());
    }

    @GetMapping("/methods")
    public List<String> methods() {
        return adjustUseCase.availableMethods();
    }
}
