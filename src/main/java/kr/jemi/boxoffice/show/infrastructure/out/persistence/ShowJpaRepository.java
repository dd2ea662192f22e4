package kr.jemi.boxoffice.show.infrastructure.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ShowJpaRepository extends JpaRepository<ShowJpaEntity, Long> {
}
