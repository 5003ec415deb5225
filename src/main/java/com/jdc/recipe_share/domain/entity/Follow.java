package com.jdc.recipe_share.domain.entity;

import com.jdc.recipe_share.domain.entity.common.BaseCreateTimeEntity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

/**
 * user 가 author 를 구독한다.
 */
@Entity
@Table(name = "follows", uniqueConstraints = {
        @UniqueConstraint(name = "uk_follow_user_author", columnNames = {"user_id", "author_id"})
})
@Check(constraints = "user_id <> author_id")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Follow extends BaseCreateTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User user;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User author;
}
