package dustin.clearing.domains.policy.rule;

import java.util.List;
import java.util.stream.Collectors;

import dustin.clearing.domains.event.model.EventKind;
import dustin.clearing.domains.event.model.SourceBucket;
import dustin.clearing.domains.participant.model.ParticipantRole;
import dustin.clearing.domains.policy.model.UseCase;

/**
 * 유스케이스별 포스팅 규칙표
 * Posting Rule Table
 *
 * 이벤트 하나에 매칭되는 규칙은 0~2개입니다.
 * 매칭되는 규칙이 없는 이벤트는 계량 전용(미가격)으로 집계됩니다.
 */
public interface PostingRuleTable {

    UseCase getUseCase();

    List<PostingRule> getRules();

    /**
     * 규칙이 출처에 따라 달라지는 이벤트 종류인지 여부
     * (unclassified_source_treatment 적용 대상)
     */
    default boolean isSourceSensitive(EventKind kind) {
        return kind == EventKind.CONSUMPTION;
    }

    default List<PostingRule> rulesFor(EventKind kind, SourceBucket bucket, ParticipantRole role) {
        return getRules().stream()
                .filter(rule -> rule.matches(kind, bucket, role))
                .collect(Collectors.toList());
    }
}
