package com.medqueue.types.exception;

import com.medqueue.types.enums.ResponseCode;

/**
 * 推理输出中的 JSON 块无法解析，由解析降级链内部消化。
 *
 * @author medqueue
 * @since 2025-10-12
 */
public class MalformedResponseException extends AppException {

    private static final long serialVersionUID = 1709236632005377125L;

    public MalformedResponseException(String message, Throwable cause) {
        super(ResponseCode.UN_ERROR.getCode(), message, cause);
    }

}
