package edu.stanford.futuredata.groupagg.localcloud;

import edu.stanford.futuredata.groupagg.interfaces.ExecutionContext;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

public class LocalExecutionContext implements ExecutionContext {

    private final Map<String, Object> data = new ConcurrentHashMap<>();
    private final Map<String, Object> remoteObjects = new ConcurrentHashMap<>();

    @Override
    public Object get(String key) {
        return data.get(key);
    }

    @Override
    public void set(String key, Object value) {
        data.put(key, value);
    }

    @Override
    public boolean contains(String key) {
        return data.containsKey(key);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T createRemoteObject(String name, Supplier<T> constructor) {
        return (T) remoteObjects.computeIfAbsent(name, n -> constructor.get());
    }

    @Override
    public <T> T getRemoteObject(String name, Class<T> type) {
        Object o = remoteObjects.get(name);
        if (o == null) {
            throw new IllegalStateException("No remote object named " + name);
        }
        return type.cast(o);
    }

    @Override
    public void destroyRemoteObject(String name) {
        remoteObjects.remove(name);
    }

    public int numRemoteObjects() {
        return remoteObjects.size();
    }

    public int numKeys() {
        return data.size();
    }
}
