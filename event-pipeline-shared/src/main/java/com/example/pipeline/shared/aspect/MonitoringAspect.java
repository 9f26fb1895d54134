package com.example.pipeline.shared.aspect;

import com.example.pipeline.shared.config.CorrelationIdFilter;
import com.example.pipeline.shared.config.MonitoringConfig;
import com.example.pipeline.shared.dto.CorrelatedRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.lang.reflect.Method;

/**
 * Times and counts calls on {@link Monitored} beans under {@code pipeline.<type>.latency},
 * {@code pipeline.<type>.calls} and {@code pipeline.errors}.
 * <p>
 * A {@link Mono} result is measured until it terminates, not until it is assembled, so
 * controller timings include the store round trip. Failures are logged with the request's
 * correlation id, read from a {@link CorrelatedRequest} argument or else from the MDC.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.PipelineMetricsCollector metricsCollector;

    @Around("@within(com.example.pipeline.shared.aspect.Monitored) || @annotation(com.example.pipeline.shared.aspect.Monitored)")
    public Object monitorMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Monitored monitored = resolve(signature.getMethod());
        if (monitored == null) {
            return joinPoint.proceed();
        }

        MonitoredCall call = new MonitoredCall(monitored.value(),
                joinPoint.getTarget().getClass().getSimpleName(),
                signature.getName(),
                correlationId(joinPoint.getArgs()));

        Object result;
        try {
            result = joinPoint.proceed();
        } catch (Exception e) {
            call.failed(e);
            throw e;
        }

        if (result instanceof Mono<?> mono) {
            return mono.doOnSuccess(value -> call.succeeded())
                    .doOnError(call::failed);
        }
        call.succeeded();
        return result;
    }

    // method-level annotation overrides the class-level one
    private static Monitored resolve(Method method) {
        Monitored monitored = method.getAnnotation(Monitored.class);
        return monitored != null ? monitored : method.getDeclaringClass().getAnnotation(Monitored.class);
    }

    private static String correlationId(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof CorrelatedRequest request && request.getCorrelationId() != null) {
                return request.getCorrelationId();
            }
        }
        return MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY);
    }

    private final class MonitoredCall {

        private final String operationType;
        private final String className;
        private final String methodName;
        private final String correlationId;
        private final long startTime = System.currentTimeMillis();

        private MonitoredCall(String operationType, String className, String methodName, String correlationId) {
            this.operationType = operationType;
            this.className = className;
            this.methodName = methodName;
            this.correlationId = correlationId;
        }

        void succeeded() {
            long duration = record("success");
            log.debug("{}.{} ({}) completed in {}ms", className, methodName, operationType, duration);
        }

        void failed(Throwable error) {
            long duration = record("error");
            metricsCollector.incrementCounter("pipeline.errors",
                    "type", operationType, "class", className, "method", methodName);
            log.error("{}.{} ({}) failed after {}ms [correlation_id={}]: {}",
                    className, methodName, operationType, duration, correlationId, error.getMessage());
        }

        private long record(String status) {
            long duration = System.currentTimeMillis() - startTime;
            metricsCollector.recordTimer("pipeline." + operationType + ".latency", duration,
                    "class", className, "method", methodName, "status", status);
            metricsCollector.incrementCounter("pipeline." + operationType + ".calls",
                    "class", className, "method", methodName, "status", status);
            return duration;
        }
    }
}
