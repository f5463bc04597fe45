package dev.personalagent.presentation.presenter;

import dev.personalagent.core.event.AppEvent;
import dev.personalagent.core.event.EventBus;
import dev.personalagent.core.event.SystemEvent;
import dev.personalagent.core.event.UserEvent;
import dev.personalagent.core.service.ServiceException;
import dev.personalagent.presentation.bridge.ViewCommandSink;
import dev.personalagent.presentation.view.ErrorSeverity;
import dev.personalagent.presentation.view.ViewCommand;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

class AbstractPresenterTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final EventBus bus = new EventBus(16);
    private final CommandRecorder recorder = new CommandRecorder();
    private final EchoPresenter presenter = new EchoPresenter(bus, recorder.sink(), executor);

    @AfterEach
    void tearDown() {
        bus.close();
        executor.shutdownNow();
    }

    // -- Lifecycle --

    @Test
    void start_shouldBeIdempotent() {
        presenter.start();
        presenter.start();

        assertTrue(presenter.isRunning());
        assertEquals(1, bus.subscriberCount());
    }

    @Test
    void start_shouldProcessEventsInPublishOrder() throws Exception {
        presenter.start();

        bus.publish(new UserEvent.SendMessage("First"));
        bus.publish(new UserEvent.SendMessage("Second"));
        bus.publish(new UserEvent.SendMessage("Third"));

        assertEquals(List.of(note("First"), note("Second"), note("Third")), recorder.awaitCommands(3));
    }

    @Test
    void stop_shouldEndLoopOnNextEventWithoutHandlingIt() throws Exception {
        presenter.start();
        presenter.stop();
        assertFalse(presenter.isRunning());

        bus.publish(new UserEvent.SendMessage("ignored"));
        Thread.sleep(200);

        assertTrue(recorder.commands().isEmpty());
        assertEquals(0, bus.subscriberCount());
    }

    @Test
    void start_afterStop_shouldRunFreshLoop() throws Exception {
        presenter.start();
        presenter.stop();
        presenter.start();

        assertTrue(presenter.isRunning());
        bus.publish(new UserEvent.SendMessage("again"));

        assertEquals(List.of(note("again")), recorder.awaitCommands(1));
        Thread.sleep(100);
        assertEquals(1, recorder.commands().size());
        assertEquals(1, bus.subscriberCount());
    }

    @Test
    void appWillTerminate_shouldEndLoopAfterHandling() throws Exception {
        presenter.start();

        bus.publish(new SystemEvent.AppWillTerminate());
        Thread.sleep(200);

        assertFalse(presenter.isRunning());
        assertEquals(0, bus.subscriberCount());
    }

    @Test
    void busClose_shouldEndLoop() throws Exception {
        presenter.start();

        bus.close();
        Thread.sleep(200);

        assertFalse(presenter.isRunning());
    }

    // -- Error handling --

    @Test
    void serviceFailure_shouldProduceExactlyOneShowErrorAndKeepRunning() throws Exception {
        presenter.start();

        bus.publish(new UserEvent.SendMessage("fail"));
        bus.publish(new UserEvent.SendMessage("after"));

        List<ViewCommand> commands = recorder.awaitCommands(2);
        var errors = recorder.commands(ViewCommand.ShowError.class);
        assertEquals(1, errors.size());
        assertTrue(errors.get(0).message().contains("disk full"));
        assertEquals(ErrorSeverity.ERROR, errors.get(0).severity());
        assertEquals(note("after"), commands.get(1));
        assertTrue(presenter.isRunning());
    }

    @Test
    void validationFailure_shouldBeShownAsWarning() throws Exception {
        presenter.start();

        bus.publish(new UserEvent.SendMessage("invalid"));

        recorder.awaitCommands(1);
        var errors = recorder.commands(ViewCommand.ShowError.class);
        assertEquals(1, errors.size());
        assertEquals(ErrorSeverity.WARNING, errors.get(0).severity());
    }

    @Test
    void unexpectedException_shouldBecomeCriticalErrorAndKeepRunning() throws Exception {
        presenter.start();

        bus.publish(new UserEvent.SendMessage("boom"));
        bus.publish(new UserEvent.SendMessage("still alive"));

        List<ViewCommand> commands = recorder.awaitCommands(2);
        var error = assertInstanceOf(ViewCommand.ShowError.class, commands.get(0));
        assertEquals(ErrorSeverity.CRITICAL, error.severity());
        assertEquals(note("still alive"), commands.get(1));
    }

    @Test
    void await_shouldWrapForeignFailures() {
        var future = CompletableFuture.<String>failedFuture(new IllegalStateException("socket closed"));

        var ex = assertThrows(ServiceException.class, () -> AbstractPresenter.await(future));
        assertEquals(ServiceException.Kind.INTERNAL, ex.getKind());
        assertEquals("socket closed", ex.getMessage());
    }

    @Test
    void await_shouldPassServiceExceptionThrough() {
        var original = ServiceException.notFound("Profile", "p1");
        var future = CompletableFuture.<String>failedFuture(original);

        assertSame(original, assertThrows(ServiceException.class, () -> AbstractPresenter.await(future)));
    }

    @Test
    void await_cancelledFuture_shouldReportCancelled() {
        var future = new CompletableFuture<String>();
        future.cancel(true);

        var ex = assertThrows(ServiceException.class, () -> AbstractPresenter.await(future));
        assertEquals(ServiceException.Kind.CANCELLED, ex.getKind());
    }

    private static ViewCommand note(String text) {
        return new ViewCommand.ShowNotification(text);
    }

    /**
     * Echoes message texts as notifications, with a few magic texts that fail.
     */
    private static final class EchoPresenter extends AbstractPresenter {

        EchoPresenter(EventBus eventBus, ViewCommandSink sink, ExecutorService executor) {
            super(eventBus, sink, executor);
        }

        @Override
        protected void handle(AppEvent event) {
            if (!(event instanceof UserEvent.SendMessage message)) {
                return;
            }
            switch (message.text()) {
                case "boom":
                    throw new IllegalStateException("boom");
                case "fail":
                    attempt("Save Failed", ErrorSeverity.ERROR, () -> await(CompletableFuture.failedFuture(
                            new ServiceException(ServiceException.Kind.STORAGE, "disk full"))));
                    break;
                case "invalid":
                    attempt("Save Failed", ErrorSeverity.ERROR, () -> await(CompletableFuture.failedFuture(
                            ServiceException.validation("name missing"))));
                    break;
                default:
                    send(new ViewCommand.ShowNotification(message.text()));
            }
        }
    }
}
