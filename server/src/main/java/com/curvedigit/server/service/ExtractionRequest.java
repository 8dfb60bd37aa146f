package com.curvedigit.server.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-side parameters of one extraction. Bounds left null are taken from the preset.
 */
public class ExtractionRequest {
    public String preset;
    public Double xMin;
    public Double xMax;
    public Double yMin;
    public Double yMax;
    public String xScaleType;
    public String yScaleType;
    public Double xScale;
    public Double yScale;
    public List<String> colors = new ArrayList<>();
    public Map<String, String> labels = new LinkedHashMap<>();
}
