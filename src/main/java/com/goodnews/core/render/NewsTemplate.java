package com.goodnews.core.render;

import java.awt.Color;

/**
 * Visual style of one news type and the text box it reserves on its background.
 *
 * @param type            template key, e.g. {@code good} or {@code bad}
 * @param backgroundImage background file name inside the assets directory
 * @param boxWidthRatio   text box width as a fraction of the image width
 * @param boxHeightRatio  text box height as a fraction of the image height
 */
public record NewsTemplate(String type,
                           String backgroundImage,
                           Color fontColor,
                           Color strokeColor,
                           int strokeWidth,
                           double boxWidthRatio,
                           double boxHeightRatio,
                           int initialFontSize,
                           int minFontSize,
                           int fontSizeStep) {

    /**
     * Text box centered on an image of the given size.
     */
    public TextBox textBox(int imageWidth, int imageHeight) {
        int width = (int) (imageWidth * boxWidthRatio);
        int height = (int) (imageHeight * boxHeightRatio);
        return new TextBox((imageWidth - width) / 2.0, (imageHeight - height) / 2.0, width, height);
    }
}
