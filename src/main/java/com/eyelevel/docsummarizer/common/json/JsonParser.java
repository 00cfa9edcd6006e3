package com.eyelevel.docsummarizer.common.json;

/**
 * Decodes JSON payloads received from remote services into typed objects.
 */
public interface JsonParser {

    <T> T parseObject(String json, Class<T> valueType);

    <T> T parseObject(byte[] jsonBytes, Class<T> valueType);
}
