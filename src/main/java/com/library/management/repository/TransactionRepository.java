package com.library.management.repository;

import com.library.management.entity.BorrowTransaction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface TransactionRepository extends JpaRepository<BorrowTransaction, Long>,
        JpaSpecificationExecutor<BorrowTransaction> {

    @Query("""
        SELECT COUNT(t) FROM BorrowTransaction t
        WHERE t.book.isbn = :isbn AND t.returned = false
        """)
    long countOpenByIsbn(@Param("isbn") String isbn);

    @Query("""
        SELECT t.book.id FROM BorrowTransaction t
        WHERE t.book.isbn = :isbn AND t.returned = false
        """)
    List<Long> findOpenBookIdsByIsbn(@Param("isbn") String isbn);

    @Query("""
        SELECT t FROM BorrowTransaction t
        JOIN FETCH t.book
        JOIN FETCH t.user
        WHERE t.id = :id
        """)
    Optional<BorrowTransaction> findByIdWithDetails(@Param("id") Long id);

    boolean existsByBookId(Long bookId);

    boolean existsByUserId(Long userId);
}
