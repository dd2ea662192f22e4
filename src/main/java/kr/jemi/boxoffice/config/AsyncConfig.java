package kr.jemi.boxoffice.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;

import java.lang.reflect.Method;

/**
 * 좌석 이벤트 브로드캐스트와 환불 정산은 모두 비동기로 실행된다.
 * 리스너에서 빠져나온 예외는 호출자에게 전달되지 않으므로 여기서 기록한다.
 */
@Configuration
public class AsyncConfig implements AsyncConfigurer {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (Throwable ex, Method method, Object... params) ->
                log.error("비동기 작업 실패: {}.{}({})", method.getDeclaringClass().getSimpleName(),
                        method.getName(), params, ex);
    }
}
