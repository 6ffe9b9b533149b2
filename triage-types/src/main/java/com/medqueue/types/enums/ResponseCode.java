package com.medqueue.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 定义系统中所有API响应的响应码和对应描述信息。
 * </p>
 *
 * @author medqueue
 * @since 2025-10-12
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 病例描述为空 */
    EMPTY_INPUT("1001", "病例描述不能为空"),

    /** 病例描述超长 */
    INPUT_TOO_LONG("1002", "病例描述超出长度限制");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
