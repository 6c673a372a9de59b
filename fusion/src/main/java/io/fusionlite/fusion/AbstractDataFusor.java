package io.fusionlite.fusion;

import io.fusionlite.core.MultiResCollection;
import io.fusionlite.core.image.Image;
import io.fusionlite.core.image.ImageStore;

import java.util.Objects;

/**
 * Holds the source collection and the output image, so concrete fusors only
 * implement options handling and {@link #predict(int, Image)}.
 */
public abstract class AbstractDataFusor implements DataFusor {

    protected ImageStore imgs;
    protected Image output = Image.empty();

    @Override
    public MultiResCollection<Image> srcImages() {
        return imgs;
    }

    @Override
    public void setSrcImages(ImageStore images) {
        this.imgs = images;
    }

    @Override
    public Image outputImage() {
        return output;
    }

    @Override
    public void setOutputImage(Image output) {
        this.output = Objects.requireNonNull(output, "output");
    }
}
