package peroxo.chat.cache;

import lombok.Value;

@Value
public class PaginationState {
    boolean hasMore;
    String nextCursor;
    boolean loading;
}
