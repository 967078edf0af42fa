package com.screenstreamer.screenstreamer.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Optional overrides for a new capture session; null fields use the configured defaults.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StartSessionRequest {
    private Integer frameRate;
    private Integer quality;
    private Integer scaleWidth;
    private Integer previewWidth;
    private String input;
}
