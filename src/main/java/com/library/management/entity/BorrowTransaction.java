package com.library.management.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * JPA entity representing one borrow event in the lending ledger.
 *
 * <p>A transaction is a two-state machine:
 * <ul>
 *   <li><em>Open</em>: {@code returned = false}, {@code returnDate = null}; the copy is out.</li>
 *   <li><em>Closed</em>: {@code returned = true}, {@code returnDate} set; terminal.</li>
 * </ul>
 *
 * <p>At most one open transaction may exist per book copy. This is enforced at the database
 * level by the partial unique index {@code ux_transactions_open_book} (migration V4):
 * <pre>
 *   CREATE UNIQUE INDEX ux_transactions_open_book
 *       ON transactions (book_id) WHERE is_returned = false;
 * </pre>
 * {@code TransactionService.borrow()} checks availability under a row lock first; the index
 * is the backstop, and its violation is reported to the caller as "no available copies".
 *
 * <p>{@link #version} guards against two concurrent returns of the same transaction.
 *
 * <p>No {@code @ToString}: both associations are lazy proxies.
 */
@Entity
@Table(name = "transactions")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class BorrowTransaction extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    /** The physical copy lent out. {@code ON DELETE RESTRICT} keeps the ledger intact. */
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "book_id", nullable = false)
    private Book book;

    @Column(name = "borrow_date", nullable = false)
    private Instant borrowDate;

    @Column(name = "return_date")
    private Instant returnDate;

    @Column(name = "is_returned", nullable = false)
    private boolean returned;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;

    public boolean isOpen() {
        return !returned;
    }
}
