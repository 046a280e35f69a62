package com.teamchat.common.error;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;

import java.util.function.Supplier;

/**
 * 写路径的存储异常翻译：连接/锁等待之类的瞬时故障统一变成 {@link TransientWriteFailureException}，
 * 由调用方（客户端）决定是否重试；其他异常原样抛出。
 */
public final class TransientWrites {

    private TransientWrites() {
    }

    public static <T> T call(Supplier<T> write) {
        try {
            return write.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException e) {
            throw new TransientWriteFailureException("storage_unavailable", e);
        }
    }

    public static void run(Runnable write) {
        call(() -> {
            write.run();
            return null;
        });
    }
}
