package io.fusionlite.fusion;

import io.fusionlite.core.image.Rectangle;

import java.util.Objects;

/**
 * Base configuration of a {@link DataFusor}.
 * <p>
 * Only the prediction area is common to all fusors. Fusor-specific options
 * extend this class and override {@link #copy()} with their own type.
 */
public class Options {
    private Rectangle predictionArea = Rectangle.NONE;

    public Options() {
    }

    protected Options(Options source) {
        this.predictionArea = source.predictionArea;
    }

    /** Area to predict; {@link Rectangle#NONE} means the full source image. */
    public Rectangle getPredictionArea() {
        return predictionArea;
    }

    public void setPredictionArea(Rectangle predictionArea) {
        this.predictionArea = Objects.requireNonNull(predictionArea, "predictionArea");
    }

    /** Independent copy; subclasses return their own type. */
    public Options copy() {
        return new Options(this);
    }
}
