package com.teamchat.auth.web;

/**
 * 请求级别的“当前 subject”上下文（未经用户目录解析的原始值）。
 *
 * <p>ThreadLocal 必须在请求结束时清理，见 AccessTokenInterceptor#afterCompletion。</p>
 */
public final class AuthContext {

    private static final ThreadLocal<String> SUBJECT = new ThreadLocal<>();

    private AuthContext() {
    }

    public static void setSubject(String subject) {
        SUBJECT.set(subject);
    }

    public static String getSubject() {
        return SUBJECT.get();
    }

    /**
     * controller 里使用：拦截器已保证 /chat/** 有值，拿不到说明路由配置错了。
     */
    public static String requireSubject() {
        String s = SUBJECT.get();
        if (s == null) {
            throw new IllegalStateException("no authenticated subject on this request");
        }
        return s;
    }

    public static void clear() {
        SUBJECT.remove();
    }
}
