package com.jdc.recipe_share;

import com.jdc.recipe_share.controller.LocalAuthController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class RecipeShareApplicationTests {

	@Autowired
	ApplicationContext context;

	@Autowired
	Environment environment;

	@Test
	void contextLoads() {
	}

	@Test
	@DisplayName("설정 파일은 local 프로필을 기본으로 켜지 않는다")
	void localProfileIsNotActivatedByDefault() {
		assertThat(environment.getActiveProfiles()).containsExactly("test");
		assertThat(context.getBeanNamesForType(LocalAuthController.class)).isEmpty();
	}

}
