package edu.stanford.futuredata.groupagg.interfaces;

import java.util.function.Supplier;

public interface ExecutionContext {
    /*
     Key-addressed storage shared by every chunk of a graph.
     Chunk outputs are stored under the key of the producing chunk.

     Concurrency contract:
     Each key is written once, by the chunk that owns it.
     Reads of a key happen only after the owning chunk completed.
     Remote objects are created, read and destroyed by the planner, and used concurrently by chunks.
     */

    // Return the data stored under a key, or null if absent.
    Object get(String key);
    // Store data under a key.
    void set(String key, Object data);
    // Is there data under this key?
    boolean contains(String key);
    // Create a named shared object, or return the existing one with that name.
    <T> T createRemoteObject(String name, Supplier<T> constructor);
    // Return a named shared object.  Fails if no object has that name.
    <T> T getRemoteObject(String name, Class<T> type);
    // Destroy a named shared object.  Destroying an absent object does nothing.
    void destroyRemoteObject(String name);

    @SuppressWarnings("unchecked")
    default <T> T get(String key, Class<T> type) {
        Object data = get(key);
        if (data == null) {
            throw new IllegalStateException("No data stored for key " + key);
        }
        if (!type.isInstance(data)) {
            throw new IllegalStateException(
                    String.format("Data of key %s is %s, expected %s", key, data.getClass().getSimpleName(), type.getSimpleName()));
        }
        return (T) data;
    }
}
