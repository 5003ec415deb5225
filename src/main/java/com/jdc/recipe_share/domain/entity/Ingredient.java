package com.jdc.recipe_share.domain.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "ingredients", uniqueConstraints = {
        @UniqueConstraint(columnNames = {"name", "measurement_unit"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Ingredient {

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(name = "measurement_unit", nullable = false, length = 200)
    private String measurementUnit;
}
