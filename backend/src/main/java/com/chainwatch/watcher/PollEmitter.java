package com.chainwatch.watcher;

@FunctionalInterface
public interface PollEmitter<N> {
    void emit(PollEmission<N> emission);
}
