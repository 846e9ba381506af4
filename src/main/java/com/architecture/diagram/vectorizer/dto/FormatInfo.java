package com.architecture.diagram.vectorizer.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FormatInfo {

    private String format;
    private String defaultLayout;
    private String extension;
}
