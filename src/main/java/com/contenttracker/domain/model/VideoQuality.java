package com.contenttracker.domain.model;

public enum VideoQuality {
    LOW("144p"),
    MEDIUM("360p"),
    HIGH("720p"),
    FULL_HD("1080p"),
    FOUR_K("2160p");

    private final String resolution;

    VideoQuality(String resolution) {
        this.resolution = resolution;
    }

    public String resolution() {
        return resolution;
    }

    public boolean isHighDefinition() {
        return compareTo(HIGH) >= 0;
    }

    @Override
    public String toString() {
        return resolution;
    }
}
