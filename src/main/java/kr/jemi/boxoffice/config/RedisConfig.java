package kr.jemi.boxoffice.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.scripting.support.ResourceScriptSource;

import java.util.List;

/**
 * 좌석 상태 전이 스크립트. 스크립트 하나가 좌석 묶음 전체를 원자적으로 전이시킨다.
 * 결과 코드: 0 성공, 1 소유 좌석 없음, 2 선점 만료, 3 일부만 소유(불변식 위반).
 */
@Configuration
public class RedisConfig {

    @Bean
    @SuppressWarnings("unchecked")
    public DefaultRedisScript<List<String>> reserveSeatsScript() {
        DefaultRedisScript<List<String>> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource("scripts/reserve-seats.lua")));
        script.setResultType((Class<List<String>>) (Class<?>) List.class);
        return script;
    }

    @Bean
    public DefaultRedisScript<Long> releaseSeatsScript() {
        return longScript("scripts/release-seats.lua");
    }

    @Bean
    public DefaultRedisScript<Long> renewSeatsScript() {
        return longScript("scripts/renew-seats.lua");
    }

    @Bean
    public DefaultRedisScript<Long> finalizeSeatsScript() {
        return longScript("scripts/finalize-seats.lua");
    }

    @Bean
    public DefaultRedisScript<Long> freeSeatsScript() {
        return longScript("scripts/free-seats.lua");
    }

    private DefaultRedisScript<Long> longScript(String path) {
        DefaultRedisScript<Long> script = new DefaultRedisScript<>();
        script.setScriptSource(new ResourceScriptSource(new ClassPathResource(path)));
        script.setResultType(Long.class);
        return script;
    }
}
