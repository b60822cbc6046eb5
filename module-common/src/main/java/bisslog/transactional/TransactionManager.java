package bisslog.transactional;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;

/**
 * Thread-confined stack of open transactions.
 *
 * <h3>Scoping</h3>
 *
 * <ul>
 *   <li>{@link #begin()} pushes a transaction with a generated id, {@link #begin(String)} one with
 *       the caller's id (for example a correlation id received from upstream).
 *   <li>{@link TransactionScope#close()} pops it; scopes must be closed in reverse order of opening.
 *   <li>The bottom of the stack is the main transaction, the top the current one.
 * </ul>
 *
 * <p>Each thread sees only the transactions it opened. Work handed to another thread has to open
 * its own scope, typically with {@code begin(parentId)}.
 */
@Slf4j
public class TransactionManager implements TransactionContext {

  private static final String NO_TRANSACTION = "";

  private static final Deque<TransactionScope> NONE_OPEN = new ArrayDeque<>(0);

  private final ThreadLocal<Deque<TransactionScope>> openScopes = new ThreadLocal<>();

  /**
   * Opens a transaction with a random UUID id.
   *
   * @return scope to close when the unit of work ends
   */
  public TransactionScope begin() {
    return begin(UUID.randomUUID().toString());
  }

  /**
   * Opens a transaction with the given id.
   *
   * @param transactionId id to trace the unit of work under
   * @return scope to close when the unit of work ends
   * @throws IllegalArgumentException if the id is null or blank
   */
  public TransactionScope begin(String transactionId) {
    if (transactionId == null || transactionId.isBlank()) {
      throw new IllegalArgumentException("transactionId must not be blank");
    }
    TransactionScope scope = new TransactionScope(this, transactionId);
    Deque<TransactionScope> scopes = openScopes.get();
    if (scopes == null) {
      scopes = new ArrayDeque<>();
      openScopes.set(scopes);
    }
    scopes.push(scope);
    log.debug("[Transaction:BEGIN] {}, depth={}", transactionId, scopes.size());
    return scope;
  }

  void end(TransactionScope scope) {
    Deque<TransactionScope> scopes = readScopes();
    if (!scopes.contains(scope)) {
      // clear() 로 이미 제거된 스코프
      log.debug("[Transaction:END] {} was already dropped", scope.getTransactionId());
      return;
    }
    if (scopes.peek() != scope) {
      throw new IllegalStateException(
          "Transaction "
              + scope.getTransactionId()
              + " is not the current transaction of this thread (current="
              + getTransactionId()
              + ")");
    }
    scopes.pop();
    log.debug("[Transaction:END] {}, depth={}", scope.getTransactionId(), scopes.size());
    if (scopes.isEmpty()) {
      // 스레드 풀 재사용 시 누수 방지
      openScopes.remove();
    }
  }

  @Override
  public String getMainTransactionId() {
    TransactionScope main = readScopes().peekLast();
    return main == null ? NO_TRANSACTION : main.getTransactionId();
  }

  @Override
  public String getTransactionId() {
    TransactionScope current = readScopes().peekFirst();
    return current == null ? NO_TRANSACTION : current.getTransactionId();
  }

  /** Number of transactions open on the calling thread. */
  public int depth() {
    return readScopes().size();
  }

  /** Drops every transaction of the calling thread without closing the scopes individually. */
  public void clear() {
    int dropped = readScopes().size();
    openScopes.remove();
    if (dropped > 0) {
      log.debug("[Transaction:CLEAR] dropped={}", dropped);
    }
  }

  // 읽기만 하는 스레드에는 스택을 만들지 않는다
  private Deque<TransactionScope> readScopes() {
    Deque<TransactionScope> scopes = openScopes.get();
    return scopes == null ? NONE_OPEN : scopes;
  }

  boolean holdsStateForCurrentThread() {
    return openScopes.get() != null;
  }
}
