package kr.jemi.boxoffice.config;

import io.hypersistence.tsid.TSID;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * 예매 ID와 예매 코드는 TSID(시각 + 노드 + 카운터 + 난수)로 만든다.
 * 노드 번호는 기동 시 Redis 카운터로 배정해 인스턴스 간 충돌을 피한다.
 */
@Configuration
public class TsidConfig {

    @Bean
    public TSID.Factory tsidFactory(StringRedisTemplate redisTemplate,
                                    @Value("${boxoffice.tsid.node-bits}") int nodeBits) {
        int maxNodeCount = 1 << nodeBits;
        Long counter = redisTemplate.opsForValue().increment("boxoffice:tsid:node:counter");
        int nodeId = (int) (counter % maxNodeCount);

        return TSID.Factory.builder()
                .withNodeBits(nodeBits)
                .withNode(nodeId)
                .build();
    }
}
