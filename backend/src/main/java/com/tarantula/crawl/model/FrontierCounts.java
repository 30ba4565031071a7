package com.tarantula.crawl.model;

public record FrontierCounts(int pending, int inFlight, int visited) {
    public boolean isDrained() {
        return pending == 0 && inFlight == 0;
    }
}
