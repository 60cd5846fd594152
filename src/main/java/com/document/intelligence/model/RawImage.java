package com.document.intelligence.model;

import lombok.Value;

import java.awt.image.BufferedImage;

@Value
public class RawImage {

    BufferedImage image;

    // resolution declared by the file itself, null when the file carries none
    Integer declaredDpi;

    String format;                     // 'png', 'jpeg', 'pdf', ...
}
