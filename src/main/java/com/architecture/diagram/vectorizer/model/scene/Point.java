package com.architecture.diagram.vectorizer.model.scene;

import lombok.Value;

@Value
public class Point {
    double x;
    double y;
}
