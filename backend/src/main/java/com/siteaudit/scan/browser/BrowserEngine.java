package com.siteaudit.scan.browser;

public interface BrowserEngine {

    BrowserSession launch();
}
