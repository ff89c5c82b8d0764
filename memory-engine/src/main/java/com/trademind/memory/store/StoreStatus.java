package com.trademind.memory.store;

public record StoreStatus(StoreMode mode, int recordCount, int dimension, String lastError) {
}
