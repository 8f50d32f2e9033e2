package com.tradingagent.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.Collection;
import java.util.Map;
import lombok.Value;

/**
 * Success envelope applied to every controller body by {@code ApiResponseAdvice}. List and map
 * bodies also report their size in {@code count}.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    boolean success;
    T data;
    Integer count;

    public static <T> ApiResponse<T> of(T data) {
        Integer count = null;
        if (data instanceof Collection<?> collection) {
            count = collection.size();
        } else if (data instanceof Map<?, ?> map) {
            count = map.size();
        }
        return new ApiResponse<>(true, data, count);
    }
}
