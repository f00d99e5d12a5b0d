package net.revivatech.domain.preview;

public enum PreviewStatus {
    GENERATING,
    READY,
    ERROR
}
