package org.knowhub.DTO;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 批量向量化结果：每个输入位置要么有向量，要么有失败原因。
 */
public class EmbeddingBatchResult {

    private final float[][] vectors;
    private final Map<Integer, String> failures = new TreeMap<>();

    public EmbeddingBatchResult(int size) {
        this.vectors = new float[size][];
    }

    public synchronized void success(int index, float[] vector) {
        vectors[index] = vector;
        failures.remove(index);
    }

    public synchronized void failure(int index, String reason) {
        vectors[index] = null;
        failures.put(index, reason);
    }

    public int size() {
        return vectors.length;
    }

    public synchronized float[] vectorAt(int index) {
        return vectors[index];
    }

    public synchronized boolean isComplete() {
        return failures.isEmpty();
    }

    public synchronized int successCount() {
        return vectors.length - failures.size();
    }

    public synchronized List<Integer> failedIndices() {
        return new ArrayList<>(failures.keySet());
    }

    public synchronized Map<Integer, String> getFailures() {
        return Collections.unmodifiableMap(new TreeMap<>(failures));
    }
}
