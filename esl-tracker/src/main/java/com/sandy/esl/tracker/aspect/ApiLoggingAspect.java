package com.sandy.esl.tracker.aspect;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Logs every call of the ESL HTTP API: request, outcome and duration.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class ApiLoggingAspect {

    private static final int MAX_BODY_CHARS = 2000;

    private final ObjectMapper objectMapper;

    @Around("@within(org.springframework.web.bind.annotation.RestController) && within(com.sandy.esl.tracker.controller..*)")
    public Object logApiCall(ProceedingJoinPoint pjp) throws Throwable {
        long start = System.currentTimeMillis();
        ServletRequestAttributes attrs = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();
        HttpServletRequest request = attrs != null ? attrs.getRequest() : null;
        String method = request != null ? request.getMethod() : "";
        String uri = request != null ? request.getRequestURI() : "";

        MethodSignature sig = (MethodSignature) pjp.getSignature();
        Object[] args = pjp.getArgs();
        String[] paramNames = sig.getParameterNames();
        Map<String, Object> argMap = new LinkedHashMap<>();
        for (int i = 0; i < args.length; i++) {
            String name = paramNames != null && i < paramNames.length ? paramNames[i] : ("arg" + i);
            argMap.put(name, args[i]);
        }
        log.info("API Request: method={} uri={} handler={} args={}", method, uri, sig.toShortString(), toJson(argMap));

        try {
            Object result = pjp.proceed();
            long cost = System.currentTimeMillis() - start;
            if (result instanceof List<?> list) {
                log.info("API Response: method={} uri={} durationMs={} size={}", method, uri, cost, list.size());
            } else {
                log.info("API Response: method={} uri={} durationMs={} result={}", method, uri, cost, toJson(result));
            }
            return result;
        } catch (Throwable t) {
            long cost = System.currentTimeMillis() - start;
            log.warn("API Error: method={} uri={} durationMs={} errorType={} message={}", method, uri, cost,
                    t.getClass().getSimpleName(), t.getMessage());
            throw t;
        }
    }

    private String toJson(Object obj) {
        if (obj == null) return "null";
        try {
            String s = objectMapper.writeValueAsString(obj);
            if (s.length() > MAX_BODY_CHARS) {
                return s.substring(0, MAX_BODY_CHARS) + "...(" + (s.length() - MAX_BODY_CHARS) + " more chars)";
            }
            return s;
        } catch (Exception e) {
            return String.valueOf(obj);
        }
    }
}
