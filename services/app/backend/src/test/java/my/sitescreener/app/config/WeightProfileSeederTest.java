package my.sitescreener.app.config;

import my.sitescreener.app.dto.WeightProfileRequest;
import my.sitescreener.app.dto.WeightProfileValidateResponse;
import my.sitescreener.app.repository.WeightProfileRepository;
import my.sitescreener.app.service.WeightProfileService;
import my.sitescreener.app.support.TestProperties;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

class WeightProfileSeederTest {
	@Test
	void seedsDefaultProfilesOnEmptyStore() {
		WeightProfileRepository repository = mock(WeightProfileRepository.class);
		WeightProfileService service = mock(WeightProfileService.class);
		WeightProfileService validatingService = new WeightProfileService(repository, TestProperties.defaults());
		when(repository.count()).thenReturn(0L);
		when(service.validate(any())).thenAnswer(invocation -> validatingService.validate(invocation.getArgument(0)));
		WeightProfileSeeder seeder = new WeightProfileSeeder(repository, service, new DefaultResourceLoader());

		seeder.run(null);

		ArgumentCaptor<WeightProfileRequest> captor = ArgumentCaptor.forClass(WeightProfileRequest.class);
		verify(service, times(3)).createNewVersion(anyString(), captor.capture());
		List<WeightProfileRequest> seeded = captor.getAllValues();
		assertThat(seeded).extracting(WeightProfileRequest::name)
				.containsExactly("default", "financial_focus", "growth_focus");
		WeightProfileRequest standard = seeded.get(0);
		assertThat(standard.activate()).isTrue();
		assertThat(standard.financialWeight()).isEqualTo(0.35);
		assertThat(standard.tierAThreshold()).isEqualTo(80.0);
		assertThat(standard.tierDThreshold()).isEqualTo(35.0);
		assertThat(standard.minYieldThreshold()).isEqualTo(10.0);
		assertThat(seeded.get(1).activate()).isFalse();
	}

	@Test
	void skipsWhenProfilesExist() {
		WeightProfileRepository repository = mock(WeightProfileRepository.class);
		WeightProfileService service = mock(WeightProfileService.class);
		when(repository.count()).thenReturn(2L);
		WeightProfileSeeder seeder = new WeightProfileSeeder(repository, service, new DefaultResourceLoader());

		seeder.run(null);

		verifyNoInteractions(service);
	}

	@Test
	void skipsInvalidProfiles() {
		WeightProfileRepository repository = mock(WeightProfileRepository.class);
		WeightProfileService service = mock(WeightProfileService.class);
		when(repository.count()).thenReturn(0L);
		when(service.validate(any())).thenReturn(new WeightProfileValidateResponse(false, List.of("name is required")));
		WeightProfileSeeder seeder = new WeightProfileSeeder(repository, service, new DefaultResourceLoader());

		seeder.run(null);

		verify(service, never()).createNewVersion(any(), any());
	}
}
