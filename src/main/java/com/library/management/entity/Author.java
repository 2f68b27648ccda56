package com.library.management.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * JPA entity representing a book author.
 *
 * <p><strong>Relationship ownership</strong>: Author is the <em>inverse</em> side of the
 * Book-Author many-to-one. The {@code books.author_id} foreign key is owned by
 * {@link Book}; assigning an author to a copy is done through {@code Book.setAuthor()}.
 *
 * <p><strong>Fetch strategy</strong>: {@code books} is {@code LAZY} and batched in groups
 * of 20, so building a page of {@code AuthorResponse} objects issues a handful of IN-clause
 * selects instead of one select per author. Every physical copy is a separate Book row,
 * so the collection lists copies, not titles.
 *
 * <p>No {@code @ToString}: Lombok's default would walk the lazy {@code books} collection.
 */
@Entity
@Table(name = "authors")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class Author extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    /** Optional contact address. Unique when present ({@code uk_authors_email}). */
    @Column(name = "email", unique = true, length = 254)
    private String email;

    @Column(name = "bio", length = 2000)
    private String bio;

    @Column(name = "birth_date")
    private LocalDate birthDate;

    @Column(name = "nationality", length = 100)
    private String nationality;

    @Column(name = "website", length = 500)
    private String website;

    /**
     * Inverse side of {@link Book#getAuthor()}. No cascade: deleting an author that still
     * has books is refused by {@code AuthorService.delete()}.
     */
    @OneToMany(mappedBy = "author", fetch = FetchType.LAZY)
    @OrderBy("id ASC")
    @BatchSize(size = 20)
    private List<Book> books = new ArrayList<>();
}
