package com.github.anirbanmu.classcal.util;

import com.dslplatform.json.DslJson;
import com.dslplatform.json.runtime.Settings;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

public final class Json {
    public static final DslJson<Object> DSL = new DslJson<>(Settings.withRuntime().includeServiceLoader());

    private Json() {
    }

    public static byte[] toBytes(Object value) throws IOException {
        ByteArrayOutputStream os = new ByteArrayOutputStream();
        DSL.serialize(value, os);
        return os.toByteArray();
    }

    public static <T> T parse(Class<T> type, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        return DSL.deserialize(type, new ByteArrayInputStream(bytes));
    }
}
