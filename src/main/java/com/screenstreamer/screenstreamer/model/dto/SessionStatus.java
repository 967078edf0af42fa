package com.screenstreamer.screenstreamer.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.screenstreamer.screenstreamer.model.SessionState;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

@Getter
@AllArgsConstructor
@NoArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionStatus {
    private SessionState state;
    private String sessionId;
    private long framesCaptured;
    private long desyncCount;
    private long bytesRead;
    private long previewDecoded;
    private long previewDropped;
    private int activeViewers;
    private String startedAt;
    private String uptime;
    private Long pid;
    private String lastError;
}
