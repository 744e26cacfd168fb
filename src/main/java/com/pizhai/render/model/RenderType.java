package com.pizhai.render.model;

public enum RenderType {
    SCREENSHOT,
    PDF
}
