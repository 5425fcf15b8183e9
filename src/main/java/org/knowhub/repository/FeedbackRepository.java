package org.knowhub.repository;

import org.knowhub.entity.FeedbackRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface FeedbackRepository extends JpaRepository<FeedbackRecord, Long> {

    Optional<FeedbackRecord> findFirstByTurnRefAndAuthorAndActiveTrueOrderByIdDesc(String turnRef, String author);

    List<FeedbackRecord> findByTurnRefAndAuthorOrderByIdAsc(String turnRef, String author);

    /**
     * 统计用：时间窗口内仍然有效的反馈
     */
    List<FeedbackRecord> findByActiveTrueAndCreatedAtGreaterThanEqualAndCreatedAtLessThan(LocalDateTime from, LocalDateTime to);

    /**
     * 导出用：时间窗口内的全部反馈，包括已被覆盖的历史记录
     */
    List<FeedbackRecord> findByCreatedAtGreaterThanEqualAndCreatedAtLessThanOrderByIdAsc(LocalDateTime from, LocalDateTime to);
}
