package com.medqueue.types.exception;

import com.medqueue.types.enums.ResponseCode;

/**
 * 病例描述为空或仅包含空白字符。
 *
 * @author medqueue
 * @since 2025-10-12
 */
public class EmptyInputException extends AppException {

    private static final long serialVersionUID = -4127702925513085904L;

    public EmptyInputException() {
        super(ResponseCode.EMPTY_INPUT);
    }

}
