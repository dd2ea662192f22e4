package kr.jemi.boxoffice.show.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ScreenSeatJpaRepository extends JpaRepository<ScreenSeatJpaEntity, Long> {
    List<ScreenSeatJpaEntity> findByScreenId(long screenId);
}
