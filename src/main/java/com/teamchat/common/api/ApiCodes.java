package com.teamchat.common.api;

/**
 * 统一错误码定义。
 *
 * <p>区间：400xx 请求/校验，401xx 身份，403xx 权限，404xx 不存在，5xxxx 服务端。</p>
 */
public final class ApiCodes {

    private ApiCodes() {
    }

    /** 参数不合法 / 业务校验失败 */
    public static final int BAD_REQUEST = 40000;

    /** 回复的消息不在同一频道 */
    public static final int INVALID_REPLY = 40001;

    /** 频道请求不合法（例如和自己建私聊） */
    public static final int INVALID_CHANNEL_REQUEST = 40002;

    /** 未登录 / token 无效 */
    public static final int UNAUTHORIZED = 40100;

    /** token 有效，但 subject 没有对应的用户记录 */
    public static final int UNKNOWN_IDENTITY = 40101;

    /** 无权访问该频道 */
    public static final int FORBIDDEN = 40300;

    public static final int NOT_FOUND = 40400;

    public static final int CHANNEL_NOT_FOUND = 40401;

    /** 服务端未预期异常 */
    public static final int INTERNAL_ERROR = 50000;

    /** 存储/传输抖动，客户端可自行重试 */
    public static final int TRANSIENT_WRITE_FAILURE = 50300;
}
