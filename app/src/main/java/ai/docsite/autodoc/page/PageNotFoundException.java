package ai.docsite.autodoc.page;

public class PageNotFoundException extends PageStoreException {

    public PageNotFoundException(String pageId) {
        super("Page not found: " + pageId);
    }
}
