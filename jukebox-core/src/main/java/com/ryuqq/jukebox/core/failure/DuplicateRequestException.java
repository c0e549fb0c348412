package com.ryuqq.jukebox.core.failure;

import com.ryuqq.jukebox.core.model.DedupKey;

/**
 * 같은 DedupKey의 요청이 이미 대기 중이거나 실행 중임.
 *
 * <p>두 번째 호출자에게만 전달되며, 첫 번째 요청은 그대로 완료됩니다.
 * 호출자는 보통 이 예외를 조용히 무시하면 됩니다.</p>
 *
 * @author Jukebox Team
 * @since 1.0.0
 */
public class DuplicateRequestException extends JukeboxException {

    private final DedupKey dedupKey;

    public DuplicateRequestException(DedupKey dedupKey) {
        super(FailureKind.DUPLICATE_IN_PROGRESS, "Duplicate request in progress: " + dedupKey);
        this.dedupKey = dedupKey;
    }

    public DedupKey getDedupKey() {
        return dedupKey;
    }
}
