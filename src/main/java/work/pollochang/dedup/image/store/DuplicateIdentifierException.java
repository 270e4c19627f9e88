package work.pollochang.dedup.image.store;

import lombok.Getter;

/**
 * 同一個識別字在同一次執行中被送入兩次。屬於呼叫端的程式錯誤，會中止執行。
 */
@Getter
public class DuplicateIdentifierException extends RuntimeException {

    private final String identifier;

    public DuplicateIdentifierException(String identifier) {
        super("識別字重複送入: " + identifier);
        this.identifier = identifier;
    }
}
