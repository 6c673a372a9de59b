package io.fusionlite.fusion.dto;

public class JsonRectangle {
    public int x;
    public int y;
    public int width;
    public int height;
}
