package edu.stanford.futuredata.groupagg.utilities;

import com.google.protobuf.ByteString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.util.UUID;

public class Utilities {
    private static final Logger logger = LoggerFactory.getLogger(Utilities.class);

    public static ByteString objectToByteString(Serializable obj) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try {
            ObjectOutput out = new ObjectOutputStream(bos);
            out.writeObject(obj);
            out.flush();
        } catch (IOException e) {
            logger.error("Serialization Failed {} {}", obj, e.getMessage());
            throw new IllegalStateException("Serialization failed for " + obj.getClass().getName(), e);
        }
        return ByteString.copyFrom(bos.toByteArray());
    }

    // Estimated in-memory footprint of a chunk's data, measured as its serialized size in bytes.
    public static long estimateSize(Serializable obj) {
        if (obj == null) {
            return 0L;
        }
        return objectToByteString(obj).size();
    }

    public static String newKey(String prefix) {
        return prefix + "-" + UUID.randomUUID();
    }
}
