package io.fusionlite.fusion.dto;

public class JsonJobConfig {
    public String type;
    public Integer threads;
    public JsonRectangle predictionArea;
}
