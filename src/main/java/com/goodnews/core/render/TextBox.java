package com.goodnews.core.render;

/**
 * Rectangle text is fitted into; {@code x}/{@code y} locate it on the canvas.
 */
public record TextBox(double x, double y, double width, double height) {
}
