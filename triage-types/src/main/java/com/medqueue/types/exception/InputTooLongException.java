package com.medqueue.types.exception;

import com.medqueue.types.enums.ResponseCode;
import lombok.Getter;

/**
 * 病例描述（去除首尾空白后）超过配置的最大长度。
 *
 * @author medqueue
 * @since 2025-10-12
 */
@Getter
public class InputTooLongException extends AppException {

    private static final long serialVersionUID = 6290533853139210861L;

    private final int length;

    private final int maxLength;

    public InputTooLongException(int length, int maxLength) {
        super(ResponseCode.INPUT_TOO_LONG,
                ResponseCode.INPUT_TOO_LONG.getInfo() + ": length=" + length + ", max=" + maxLength);
        this.length = length;
        this.maxLength = maxLength;
    }

}
