package com.jdc.recipe_share.domain.entity;

import com.jdc.recipe_share.domain.entity.common.BaseTimeEntity;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;


@Entity
@Table(
        name = "recipes",
        indexes = {
                @Index(name = "idx_author_id", columnList = "author_id")
        }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Recipe extends BaseTimeEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "author_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User author;

    @Column(length = 200, nullable = false)
    private String name;

    @Column(length = 255)
    private String image;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String text;

    @Column(name = "cooking_time", nullable = false)
    private Integer cookingTime;

    public void update(String name, String text, Integer cookingTime) {
        this.name = name;
        this.text = text;
        this.cookingTime = cookingTime;
    }

    public void updateImage(String image) {
        this.image = image;
    }

    public boolean isAuthor(Long userId) {
        return userId != null && author != null && userId.equals(author.getId());
    }
}
