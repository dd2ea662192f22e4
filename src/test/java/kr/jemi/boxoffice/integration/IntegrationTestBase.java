package kr.jemi.boxoffice.integration;

import kr.jemi.boxoffice.booking.application.port.out.PaymentPort;
import kr.jemi.boxoffice.booking.infrastructure.in.scheduler.StaleBookingScheduler;
import kr.jemi.boxoffice.booking.infrastructure.out.persistence.BookingJpaRepository;
import kr.jemi.boxoffice.common.infrastructure.in.scheduler.EventResubmitScheduler;
import kr.jemi.boxoffice.show.domain.ScreenSeat;
import kr.jemi.boxoffice.show.domain.Show;
import kr.jemi.boxoffice.show.infrastructure.out.persistence.ScreenSeatJpaEntity;
import kr.jemi.boxoffice.show.infrastructure.out.persistence.ScreenSeatJpaRepository;
import kr.jemi.boxoffice.show.infrastructure.out.persistence.ShowJpaEntity;
import kr.jemi.boxoffice.show.infrastructure.out.persistence.ShowJpaRepository;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.cache.CacheManager;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

@SpringBootTest
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public abstract class IntegrationTestBase {

    @ServiceConnection
    static final MySQLContainer<?> mysql = new MySQLContainer<>("mysql:8.0");

    static final GenericContainer<?> redis =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
                    .withExposedPorts(6379);

    static {
        mysql.start();
        redis.start();
    }

    @DynamicPropertySource
    static void redisProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", redis::getFirstMappedPort);
    }

    @MockitoBean
    StaleBookingScheduler staleBookingScheduler;

    @MockitoBean
    EventResubmitScheduler eventResubmitScheduler;

    @MockitoBean
    protected PaymentPort paymentPort;

    @Autowired
    protected StringRedisTemplate redisTemplate;

    @Autowired
    protected BookingJpaRepository bookingJpaRepository;

    @Autowired
    protected ShowJpaRepository showJpaRepository;

    @Autowired
    protected ScreenSeatJpaRepository screenSeatJpaRepository;

    @Autowired
    private CacheManager cacheManager;

    @BeforeEach
    void cleanUp() {
        redisTemplate.execute((RedisCallback<Object>) connection -> {
            connection.serverCommands().flushAll();
            return null;
        });
        bookingJpaRepository.deleteAll();
        showJpaRepository.deleteAll();
        screenSeatJpaRepository.deleteAll();
        cacheManager.getCacheNames().forEach(name -> cacheManager.getCache(name).clear());
    }

    /**
     * 사흘 뒤 상영, 기본가 10000원, 모든 좌석 STANDARD 등급.
     */
    protected void seedShow(long showId, String... seatIds) {
        long screenId = showId;
        Arrays.stream(seatIds).forEach(seatId -> screenSeatJpaRepository.save(
                ScreenSeatJpaEntity.fromDomain(new ScreenSeat(seatId, screenId, "STANDARD", BigDecimal.ZERO))));
        showJpaRepository.save(ShowJpaEntity.fromDomain(new Show(showId, "인터스텔라", screenId,
                Instant.now().plus(Duration.ofDays(3)), new BigDecimal("10000"), seatIds.length)));
    }
}
