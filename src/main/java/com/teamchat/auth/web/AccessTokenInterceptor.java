package com.teamchat.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamchat.auth.service.JwtService;
import com.teamchat.common.api.ApiCodes;
import com.teamchat.common.api.Result;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * /chat/** 强制要求 Bearer accessToken：解析出 subject 放进 request attribute 与 {@link AuthContext}。
 *
 * <p>这里只做令牌校验；subject 是否在用户目录中由业务层的 IdentityResolver 判断。</p>
 */
@Slf4j
@Component
public class AccessTokenInterceptor implements HandlerInterceptor {

    public static final String REQ_ATTR_SUBJECT = "X-Auth-Subject";

    private final JwtService jwtService;
    private final ObjectMapper objectMapper;

    public AccessTokenInterceptor(JwtService jwtService, ObjectMapper objectMapper) {
        this.jwtService = jwtService;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String header = request.getHeader("Authorization");
        if (header == null || !header.startsWith("Bearer ")) {
            writeUnauthorized(request, response, "missing_access_token");
            return false;
        }
        String token = header.substring("Bearer ".length()).trim();
        try {
            String subject = jwtService.subjectOf(token);
            request.setAttribute(REQ_ATTR_SUBJECT, subject);
            AuthContext.setSubject(subject);
            return true;
        } catch (Exception e) {
            log.debug("access token rejected: path={}, err={}", request.getRequestURI(), e.toString());
            writeUnauthorized(request, response, "unauthorized");
            return false;
        }
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler, Exception ex) {
        AuthContext.clear();
    }

    private void writeUnauthorized(HttpServletRequest request, HttpServletResponse response, String reason) {
        response.setStatus(401);
        response.setCharacterEncoding("UTF-8");
        response.setContentType("application/json;charset=UTF-8");
        try {
            response.getWriter().write(objectMapper.writeValueAsString(Result.fail(ApiCodes.UNAUTHORIZED, reason)));
        } catch (Exception writeErr) {
            log.debug("write unauthorized response failed: path={}, err={}", request.getRequestURI(), writeErr.toString());
        }
    }
}
