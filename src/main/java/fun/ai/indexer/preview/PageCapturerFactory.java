package fun.ai.indexer.preview;

@FunctionalInterface
public interface PageCapturerFactory {

    PageCapturer create();
}
