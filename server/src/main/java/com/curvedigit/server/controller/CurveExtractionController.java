package com.curvedigit.server.controller;

import com.curvedigit.server.extraction.CalibrationException;
import com.curvedigit.server.extraction.CurvePoint;
import com.curvedigit.server.extraction.CurveSeries;
import com.curvedigit.server.extraction.DetectedColor;
import com.curvedigit.server.extraction.ExtractionResult;
import com.curvedigit.server.extraction.GridDetectionException;
import com.curvedigit.server.extraction.QuadCorners;
import com.curvedigit.server.extraction.RasterImage;
import com.curvedigit.server.extraction.config.GraphPreset;
import com.curvedigit.server.service.CurveExtractionService;
import com.curvedigit.server.service.ExtractionRequest;
import org.opencv.core.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class CurveExtractionController {

    private static final Logger logger = LoggerFactory.getLogger(CurveExtractionController.class);
    private final CurveExtractionService extractionService;

    public CurveExtractionController(CurveExtractionService extractionService) {
        this.extractionService = extractionService;
    }

    public static class PointDto {
        public double x;
        public double y;

        PointDto(CurvePoint p) {
            this.x = p.getX();
            this.y = p.getY();
        }
    }

    public static class CurveDto {
        public String name;
        public String label;
        public int pointCount;
        public int droppedBins;
        public List<PointDto> points = new ArrayList<>();
    }

    public static class ExtractionResponse {
        public boolean success;
        public List<CurveDto> curves = new ArrayList<>();
        public int totalPoints;
        public int gridSize;
        public List<String> skippedColors;
        public long processingTimeMs;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", "curve-extraction");
        body.put("version", "0.1.0");
        return body;
    }

    @GetMapping("/api/curve-extraction/presets")
    public Map<String, GraphPreset> presets() {
        return extractionService.getPresets();
    }

    @PostMapping("/api/curve-extraction/detect-colors")
    public ResponseEntity<?> detectColors(@RequestParam("file") MultipartFile file) throws IOException {
        try (RasterImage image = RasterImage.decode(file.getBytes())) {
            List<DetectedColor> colors = extractionService.detectColors(image);
            logger.info("Detected {} colors in {}", colors.size(), file.getOriginalFilename());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("detectedColors", colors);
            return ResponseEntity.ok(body);
        }
    }

    @PostMapping("/api/curve-extraction/debug-boundaries")
    public ResponseEntity<?> debugBoundaries(@RequestParam("file") MultipartFile file) throws IOException {
        try (RasterImage image = RasterImage.decode(file.getBytes())) {
            QuadCorners corners = extractionService.detectBoundary(image);
            logger.info("Boundary of {}: {}", file.getOriginalFilename(), corners);
            List<double[]> boundaries = new ArrayList<>();
            for (Point p : new Point[] { corners.getTopLeft(), corners.getTopRight(), corners.getBottomRight(),
                    corners.getBottomLeft() }) {
                boundaries.add(new double[] { p.x, p.y });
            }
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("boundaries", boundaries);
            body.put("imageSize", new int[] { image.getHeight(), image.getWidth() });
            return ResponseEntity.ok(body);
        }
    }

    @PostMapping("/api/curve-extraction/extract-curves")
    public ResponseEntity<?> extractCurves(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "preset", required = false) String preset,
            @RequestParam(value = "xMin", required = false) Double xMin,
            @RequestParam(value = "xMax", required = false) Double xMax,
            @RequestParam(value = "yMin", required = false) Double yMin,
            @RequestParam(value = "yMax", required = false) Double yMax,
            @RequestParam(value = "xScaleType", required = false) String xScaleType,
            @RequestParam(value = "yScaleType", required = false) String yScaleType,
            @RequestParam(value = "xScale", required = false) Double xScale,
            @RequestParam(value = "yScale", required = false) Double yScale,
            @RequestParam(value = "colors", required = false) String colors,
            @RequestParam(value = "labels", required = false) String labels) throws IOException {
        long start = System.currentTimeMillis();

        ExtractionRequest request = new ExtractionRequest();
        request.preset = preset;
        request.xMin = xMin;
        request.xMax = xMax;
        request.yMin = yMin;
        request.yMax = yMax;
        request.xScaleType = xScaleType;
        request.yScaleType = yScaleType;
        request.xScale = xScale;
        request.yScale = yScale;
        request.colors = parseList(colors);
        request.labels = parseLabels(labels);

        ExtractionResult result;
        try (RasterImage image = RasterImage.decode(file.getBytes())) {
            result = extractionService.extract(image, request);
        }

        ExtractionResponse response = new ExtractionResponse();
        for (CurveSeries series : result.getCurves().values()) {
            CurveDto dto = new CurveDto();
            dto.name = series.getBaseColor();
            dto.label = series.getLabel();
            dto.pointCount = series.size();
            dto.droppedBins = series.getDroppedBins();
            for (CurvePoint p : series.getPoints()) {
                dto.points.add(new PointDto(p));
            }
            response.curves.add(dto);
        }
        response.success = !response.curves.isEmpty();
        response.totalPoints = result.getTotalPoints();
        response.gridSize = result.getGridSizeEstimate();
        response.skippedColors = result.getSkippedColors();
        response.processingTimeMs = System.currentTimeMillis() - start;
        return ResponseEntity.ok(response);
    }

    @ExceptionHandler(GridDetectionException.class)
    public ResponseEntity<?> onGridDetection(GridDetectionException e) {
        logger.warn("Grid detection failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(error(e.getMessage()));
    }

    @ExceptionHandler({ CalibrationException.class, IllegalArgumentException.class })
    public ResponseEntity<?> onBadRequest(RuntimeException e) {
        logger.warn("Rejected extraction request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(error(e.getMessage()));
    }

    private static Map<String, Object> error(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return body;
    }

    // "red, blue" -> [red, blue]
    static List<String> parseList(String csv) {
        List<String> out = new ArrayList<>();
        if (csv == null || csv.trim().isEmpty()) {
            return out;
        }
        for (String s : Arrays.asList(csv.split(","))) {
            if (!s.trim().isEmpty()) {
                out.add(s.trim());
            }
        }
        return out;
    }

    // "red=Vgs 5V,blue=Vgs 2V" -> {red: Vgs 5V, blue: Vgs 2V}
    static Map<String, String> parseLabels(String spec) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String pair : parseList(spec)) {
            int eq = pair.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Label must look like color=label: " + pair);
            }
            out.put(pair.substring(0, eq).trim(), pair.substring(eq + 1).trim());
        }
        return out;
    }
}
