package com.convolab.server.controller;

import com.convolab.server.config.ConvolutionConfig;
import com.convolab.server.engine.ConvolutionResult;
import com.convolab.server.engine.ConvolutionStep;
import com.convolab.server.engine.HighlightRegion;
import com.convolab.server.engine.Matrix;
import com.convolab.server.engine.OutputDimensions;
import com.convolab.server.engine.PaddingAmounts;
import com.convolab.server.engine.PaddingMode;
import com.convolab.server.kernel.KernelPreset;
import com.convolab.server.service.ConvolutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class ConvolutionController {

    private static final Logger logger = LoggerFactory.getLogger(ConvolutionController.class);
    private final ConvolutionService convolutionService;

    public ConvolutionController(ConvolutionService convolutionService) {
        this.convolutionService = convolutionService;
    }

    public static class ResolvePaddingRequest {
        public int inputH;
        public int inputW;
        public int kernelH;
        public int kernelW;
        public int strideH = 1;
        public int strideW = 1;
        public PaddingMode padding;
    }

    public static class ApplyPaddingRequest {
        public Matrix matrix;
        public PaddingAmounts amounts;
        public PaddingMode padding;
    }

    public static class ConvolveRequest {
        public Matrix input;
        // Either an explicit kernel or a preset (+ optional size)
        public Matrix kernel;
        public KernelPreset preset;
        public Integer kernelSize;
        public Integer stride;
        public PaddingMode padding;
        public boolean normalize = false;
        public boolean includeSteps = true;
        public Integer highlightStep;
    }

    public static class ConvolveResponse {
        public Matrix output;
        public Matrix display;
        public OutputDimensions outputDimensions;
        public PaddingAmounts paddingValues;
        public int stepCount;
        public List<ConvolutionStep> steps;
        public HighlightRegion highlight;
    }

    @PostMapping("/padding/resolve")
    public ResponseEntity<?> resolvePadding(@RequestBody ResolvePaddingRequest request) {
        PaddingAmounts amounts = convolutionService.resolvePadding(request.inputH, request.inputW, request.kernelH,
                request.kernelW, request.strideH, request.strideW, request.padding);
        return ResponseEntity.ok(amounts);
    }

    @PostMapping("/padding/apply")
    public ResponseEntity<?> applyPadding(@RequestBody ApplyPaddingRequest request) {
        if (request.matrix == null) {
            return ResponseEntity.badRequest().body("Missing matrix.");
        }
        return ResponseEntity.ok(convolutionService.applyPadding(request.matrix, request.amounts, request.padding));
    }

    @GetMapping("/kernels")
    public List<Map<String, Object>> listKernels() {
        List<Map<String, Object>> presets = new ArrayList<>();
        for (KernelPreset p : KernelPreset.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("key", p.getKey());
            entry.put("name", p.getDisplayName());
            entry.put("naturalSize", p.getNaturalSize());
            presets.add(entry);
        }
        return presets;
    }

    @GetMapping("/kernels/{preset}")
    public ResponseEntity<?> kernel(@PathVariable("preset") String preset,
            @RequestParam(value = "size", required = false) Integer size) {
        return ResponseEntity.ok(convolutionService.synthesizeKernel(KernelPreset.fromKey(preset), size));
    }

    @PostMapping("/convolve")
    public ResponseEntity<?> convolve(@RequestBody ConvolveRequest request) {
        if (request.input == null) {
            return ResponseEntity.badRequest().body("Missing input matrix.");
        }

        logger.info("Received convolution request: {}x{} input, preset={}, stride={}, padding={}",
                request.input.rows(), request.input.cols(), request.preset, request.stride, request.padding);

        ConvolutionResult result = request.kernel != null
                ? convolutionService.convolve(request.input, request.kernel, request.stride, request.padding)
                : convolutionService.convolvePreset(request.input, request.preset, request.kernelSize,
                        request.stride, request.padding);

        ConvolveResponse response = new ConvolveResponse();
        response.output = result.getOutput();
        response.display = convolutionService.displayMatrix(result, request.normalize);
        response.outputDimensions = result.getOutputDimensions();
        response.paddingValues = result.getPaddingValues();
        response.stepCount = result.getSteps().size();
        response.steps = request.includeSteps ? result.getSteps() : Collections.emptyList();
        if (request.highlightStep != null) {
            response.highlight = convolutionService.highlight(result, request.highlightStep);
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/config")
    public ConvolutionConfig config() {
        return convolutionService.getConfig();
    }

    @GetMapping("/samples/{name}")
    public ResponseEntity<?> sample(@PathVariable("name") String name,
            @RequestParam(value = "size", required = false) Integer size,
            @RequestParam(value = "seed", required = false) Long seed) {
        return ResponseEntity.ok(convolutionService.sample(name, size, seed));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> handleBadArgument(IllegalArgumentException e) {
        logger.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}
