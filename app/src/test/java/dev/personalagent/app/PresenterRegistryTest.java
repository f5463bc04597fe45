package dev.personalagent.app;

import dev.personalagent.presentation.presenter.Presenter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PresenterRegistryTest {

    @Mock
    private Presenter first;

    @Mock
    private Presenter second;

    private PresenterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new PresenterRegistry(List.of(first, second));
    }

    @Test
    void startAll_shouldStartEveryPresenter() {
        registry.startAll();

        verify(first).start();
        verify(second).start();
    }

    @Test
    void stopAll_shouldStopEveryPresenter() {
        registry.stopAll();

        verify(first).stop();
        verify(second).stop();
    }

    @Test
    void runningCount_shouldCountOnlyRunningPresenters() {
        when(first.isRunning()).thenReturn(true);
        when(second.isRunning()).thenReturn(false);

        assertEquals(1, registry.runningCount());
    }
}
