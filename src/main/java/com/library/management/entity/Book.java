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

/**
 * JPA entity representing one <em>physical copy</em> of a book.
 *
 * <p><strong>ISBN groups</strong>: {@code isbn} is mandatory but deliberately not unique.
 * Every row sharing an ISBN is an interchangeable copy of the same title, and the copy
 * counts reported by {@code AvailabilityService} are aggregated over that group
 * (index {@code idx_books_isbn}). There is no stored copy counter: how many copies are
 * out is derived from the open rows in {@code transactions}.
 *
 * <p><strong>Row locks</strong>: {@code TransactionService.borrow()} takes
 * {@code PESSIMISTIC_WRITE} locks on every row of an ISBN group before counting open
 * transactions, which serialises concurrent borrows of the same title.
 *
 * <p><strong>Optimistic locking</strong>: {@link #version} guards concurrent admin edits;
 * a lost update surfaces as {@code ObjectOptimisticLockingFailureException} (409).
 *
 * <p>{@code author} is optional and {@code LAZY}; {@code BookMapper} only reads its id and
 * name inside the service transaction.
 */
@Entity
@Table(name = "books")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Book extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "isbn", nullable = false, length = 13)
    private String isbn;

    @Column(name = "description", length = 1000)
    private String description;

    /** Publication year (year only). Nullable. */
    @Column(name = "published_year")
    private Integer publishedYear;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id")
    private Author author;

    @Version
    @Column(name = "version", nullable = false)
    private Integer version;
}
