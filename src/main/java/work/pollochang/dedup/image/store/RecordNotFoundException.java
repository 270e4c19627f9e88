package work.pollochang.dedup.image.store;

import lombok.Getter;

/**
 * 查詢了不存在的識別字。
 */
@Getter
public class RecordNotFoundException extends RuntimeException {

    private final String identifier;

    public RecordNotFoundException(String identifier) {
        super("找不到識別字: " + identifier);
        this.identifier = identifier;
    }
}
