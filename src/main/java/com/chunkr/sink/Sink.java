package com.chunkr.sink;

public enum Sink {
    VECTOR_STORE,
    SEARCH_INDEX
}
