package cn.hjw.dev.wrangleflow.store;

import cn.hjw.dev.wrangleflow.config.ExecutionConfig;
import cn.hjw.dev.wrangleflow.exception.ArtifactNotFoundException;
import cn.hjw.dev.wrangleflow.exception.ArtifactStorageException;
import cn.hjw.dev.wrangleflow.model.WorkflowEdge;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FileUtils;
import org.apache.commons.lang3.SerializationException;
import org.apache.commons.lang3.SerializationUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单次运行的中间结果存储
 * dataId = nodeId + ":" + outputName
 * 小于阈值的载荷常驻内存，超过阈值的序列化到运行目录下，内存里只保留文件引用；调用方无需关心数据在哪
 * 只有内部的索引表需要加锁：每个节点只写自己名下的 dataId
 */
@Slf4j
public class DataStore {

    private static final String SPILL_SUFFIX = ".ser";

    @Getter
    private final String executionId;
    @Getter
    private final Path runCacheDir;
    @Getter
    private final long memoryThresholdBytes;
    private final PayloadSizeEstimator sizeEstimator;

    private final Map<String, StoredArtifact> entries = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public DataStore(String executionId, ExecutionConfig config) {
        this(executionId, config.getCacheDir(), config.getMemoryThresholdBytes());
    }

    public DataStore(String executionId, Path cacheDir, long memoryThresholdBytes) {
        this(executionId, cacheDir, memoryThresholdBytes, new PayloadSizeEstimator());
    }

    public DataStore(String executionId, Path cacheDir, long memoryThresholdBytes, PayloadSizeEstimator sizeEstimator) {
        this.executionId = executionId;
        this.runCacheDir = cacheDir.resolve(sanitize(executionId));
        this.memoryThresholdBytes = memoryThresholdBytes;
        this.sizeEstimator = sizeEstimator;
        log.info("DataStore initialized for execution {} (cache dir: {})", executionId, runCacheDir);
    }

    public static String dataId(String nodeId, String outputName) {
        return nodeId + ":" + outputName;
    }

    /**
     * 存储节点输出；同一个 dataId 再次写入时整体替换旧值
     * Map/List/Set 会被复制成只读结构，写入后生产方和消费方都改不到已存的数据
     * @return dataId
     */
    public String store(String nodeId, String outputName, Object value) {
        String dataId = dataId(nodeId, outputName);
        Object data = freeze(value);
        long estimated = sizeEstimator.estimate(data);

        StoredArtifact artifact;
        if (estimated < memoryThresholdBytes) {
            artifact = StoredArtifact.inMemory(data, estimated);
            log.debug("Data from node {} stored in memory (ID: {}, ~{} bytes)", nodeId, dataId, estimated);
        } else if (!(data instanceof Serializable)) {
            artifact = StoredArtifact.inMemory(data, estimated);
            log.warn("Data {} (~{} bytes) exceeds the memory threshold but {} is not serializable, keeping it in memory",
                    dataId, estimated, data.getClass().getName());
        } else {
            Path file = spill(dataId, (Serializable) data);
            artifact = StoredArtifact.onDisk(file, estimated);
            log.debug("Data from node {} stored on disk (ID: {}, Path: {}, ~{} bytes)", nodeId, dataId, file, estimated);
        }

        StoredArtifact previous;
        lock.lock();
        try {
            previous = entries.put(dataId, artifact);
        } finally {
            lock.unlock();
        }
        if (previous != null && previous.isSpilled() && !previous.getFile().equals(artifact.getFile())) {
            deleteQuietly(previous.getFile());
        }
        return dataId;
    }

    /**
     * 读取数据，落盘的数据会被透明地读回
     * @throws ArtifactNotFoundException dataId 不存在
     */
    public Object get(String dataId) {
        StoredArtifact artifact;
        lock.lock();
        try {
            artifact = entries.get(dataId);
        } finally {
            lock.unlock();
        }
        if (artifact == null) {
            throw new ArtifactNotFoundException(dataId);
        }
        return artifact.isSpilled() ? load(dataId, artifact.getFile()) : artifact.getValue();
    }

    public Object get(String nodeId, String outputName) {
        return get(dataId(nodeId, outputName));
    }

    /**
     * 按入边收集节点输入
     * 上游 sourceNodeId:sourceHandle 的数据放到 targetHandle 下；上游数据缺失只告警，对应的 key 不出现
     */
    public Map<String, Object> getNodeInputs(String nodeId, Collection<WorkflowEdge> edges) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        for (WorkflowEdge edge : edges) {
            if (!edge.getTarget().equals(nodeId)) {
                continue;
            }
            try {
                inputs.put(edge.getTargetHandle(), get(edge.sourceDataId()));
            } catch (ArtifactNotFoundException e) {
                log.warn("Data not found for edge {} -> {} (missing {})", edge.getSource(), nodeId, edge.sourceDataId());
            }
        }
        return inputs;
    }

    public boolean contains(String dataId) {
        lock.lock();
        try {
            return entries.containsKey(dataId);
        } finally {
            lock.unlock();
        }
    }

    public boolean isSpilled(String dataId) {
        lock.lock();
        try {
            StoredArtifact artifact = entries.get(dataId);
            return artifact != null && artifact.isSpilled();
        } finally {
            lock.unlock();
        }
    }

    public List<String> dataIds() {
        lock.lock();
        try {
            return new ArrayList<>(entries.keySet());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 清空整次运行的数据 (内存和落盘文件)
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
        try {
            FileUtils.deleteDirectory(runCacheDir.toFile());
        } catch (IOException e) {
            throw new ArtifactStorageException("Failed to remove cache directory " + runCacheDir, null, e);
        }
        log.info("Cleared all cache for execution {}", executionId);
    }

    /**
     * 清理指定节点的全部输出；重复清理是空操作
     */
    public void clear(Collection<String> nodeIds) {
        if (nodeIds == null) {
            clear();
            return;
        }
        List<StoredArtifact> removed = new ArrayList<>();
        lock.lock();
        try {
            for (String nodeId : nodeIds) {
                String prefix = nodeId + ":";
                entries.entrySet().removeIf(e -> {
                    if (e.getKey().startsWith(prefix)) {
                        removed.add(e.getValue());
                        return true;
                    }
                    return false;
                });
            }
        } finally {
            lock.unlock();
        }
        removed.stream().filter(StoredArtifact::isSpilled).forEach(a -> deleteQuietly(a.getFile()));
        log.info("Cleared cache for nodes {}", nodeIds);
    }

    private Path spill(String dataId, Serializable data) {
        Path target = runCacheDir.resolve(sanitize(dataId) + SPILL_SUFFIX);
        Path temp = runCacheDir.resolve(sanitize(dataId) + SPILL_SUFFIX + ".tmp");
        try {
            FileUtils.forceMkdir(runCacheDir.toFile());
            try (OutputStream out = Files.newOutputStream(temp)) {
                SerializationUtils.serialize(data, out);
            }
            // 先写临时文件再替换，读方不会看到写了一半的文件
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            return target;
        } catch (IOException | SerializationException e) {
            deleteQuietly(temp);
            throw new ArtifactStorageException("Failed to spill data " + dataId + " to " + target, dataId, e);
        }
    }

    private Object load(String dataId, Path file) {
        if (!Files.exists(file)) {
            throw new ArtifactStorageException("Cache file not found: " + file, dataId, null);
        }
        try (InputStream in = Files.newInputStream(file)) {
            return SerializationUtils.deserialize(in);
        } catch (IOException | SerializationException e) {
            throw new ArtifactStorageException("Failed to read data " + dataId + " from " + file, dataId, e);
        }
    }

    private void deleteQuietly(Path file) {
        if (!FileUtils.deleteQuietly(file.toFile()) && Files.exists(file)) {
            log.warn("Could not delete cache file {}", file);
        }
    }

    /**
     * 递归复制容器并包成只读；DataTable 本身不可变，其它值原样保留
     */
    static Object freeze(Object value) {
        if (value instanceof Map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> copy.put(k, freeze(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Set) {
            Set<Object> copy = new LinkedHashSet<>();
            ((Set<?>) value).forEach(v -> copy.add(freeze(v)));
            return Collections.unmodifiableSet(copy);
        }
        if (value instanceof Collection) {
            List<Object> copy = new ArrayList<>();
            ((Collection<?>) value).forEach(v -> copy.add(freeze(v)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * dataId 里 ':' '/' 等字符不能出现在文件名里
     */
    static String sanitize(String id) {
        return id.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    @Getter
    @RequiredArgsConstructor
    private static class StoredArtifact {
        private final Object value;
        private final Path file;
        private final long estimatedBytes;

        static StoredArtifact inMemory(Object value, long estimatedBytes) {
            return new StoredArtifact(value, null, estimatedBytes);
        }

        static StoredArtifact onDisk(Path file, long estimatedBytes) {
            return new StoredArtifact(null, file, estimatedBytes);
        }

        boolean isSpilled() {
            return file != null;
        }
    }
}
