package com.expertrelay.infrastructure.util;

import com.expertrelay.domain.knowledge.model.valobj.RetrievedCandidate;
import com.expertrelay.types.enums.ResponseCode;
import com.expertrelay.types.exception.AppException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * JSON 编解码工具，用于 Query 候选列表与提醒档位等 JSONB 列。
 *
 * @author expertrelay
 * @since 2026-03-02
 */
@Component
public class JsonCodec {

    private static final TypeReference<List<RetrievedCandidate>> CANDIDATE_LIST_REF = new TypeReference<List<RetrievedCandidate>>() {};
    private static final TypeReference<Set<Integer>> INTEGER_SET_REF = new TypeReference<Set<Integer>>() {};

    private final ObjectMapper objectMapper;

    public JsonCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * 读取检索候选列表。
     */
    public List<RetrievedCandidate> readCandidates(String json) {
        return readValue(json, CANDIDATE_LIST_REF);
    }

    public RetrievedCandidate readCandidate(String json) {
        return readValue(json, new TypeReference<RetrievedCandidate>() {});
    }

    /**
     * 读取整数集合（提醒档位）。
     */
    public Set<Integer> readIntegerSet(String json) {
        return readValue(json, INTEGER_SET_REF);
    }

    public <T> T readValue(String json, TypeReference<T> type) {
        if (StringUtils.isBlank(json)) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to parse json", ex);
        }
    }

    public String writeValue(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AppException(ResponseCode.UN_ERROR.getCode(), "Failed to write json", ex);
        }
    }
}
