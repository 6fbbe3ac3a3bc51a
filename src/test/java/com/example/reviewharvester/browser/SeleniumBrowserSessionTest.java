package com.example.reviewharvester.browser;

import com.example.reviewharvester.scraper.HarvestException;
import com.example.reviewharvester.scraper.NavigationException;
import com.example.reviewharvester.scraper.ScriptExecutionException;
import com.example.reviewharvester.scraper.SessionCrashException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openqa.selenium.JavascriptException;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.NoSuchSessionException;
import org.openqa.selenium.TimeoutException;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.mockito.Mockito.withSettings;

class SeleniumBrowserSessionTest {

    private static final String URL = "https://www.google.com/maps/place/?q=place_id:p1";

    private WebDriver driver;
    private JavascriptExecutor js;
    private SeleniumBrowserSession session;

    @BeforeEach
    void setUp() {
        driver = mock(WebDriver.class, withSettings().extraInterfaces(JavascriptExecutor.class));
        js = (JavascriptExecutor) driver;
        session = new SeleniumBrowserSession(driver);
    }

    @Test
    void errorStatusOnTheMainDocumentIsFatal() {
        when(js.executeScript(SeleniumBrowserSession.STATUS_SCRIPT)).thenReturn(404L);

        NavigationException e = catchThrowableOfType(() -> session.navigate(URL), NavigationException.class);

        assertThat(e.httpStatus()).isEqualTo(404);
        assertThat(e.isRetryable()).isFalse();
    }

    @Test
    void okStatusNavigatesNormally() throws HarvestException {
        when(js.executeScript(SeleniumBrowserSession.STATUS_SCRIPT)).thenReturn(200L);

        session.navigate(URL);

        verify(driver).get(URL);
    }

    @Test
    void pageLoadTimeoutIsRetryable() {
        doThrow(new TimeoutException("timed out")).when(driver).get(URL);

        NavigationException e = catchThrowableOfType(() -> session.navigate(URL), NavigationException.class);

        assertThat(e.isRetryable()).isTrue();
    }

    @Test
    void networkErrorIsFatalNavigation() {
        doThrow(new WebDriverException("unknown error: net::ERR_NAME_NOT_RESOLVED")).when(driver).get(URL);

        NavigationException e = catchThrowableOfType(() -> session.navigate(URL), NavigationException.class);

        assertThat(e.isRetryable()).isFalse();
    }

    @Test
    void scriptErrorIsRetryable() {
        when(js.executeScript(anyString())).thenThrow(new JavascriptException("Cannot read properties of null"));

        assertThatThrownBy(() -> session.evaluate("return x.y;"))
                .isInstanceOf(ScriptExecutionException.class)
                .hasMessageContaining("Cannot read properties of null")
                .matches(e -> ((HarvestException) e).isRetryable());
    }

    @Test
    void lostSessionIsACrash() {
        when(js.executeScript(anyString())).thenThrow(new NoSuchSessionException("invalid session id"));

        assertThatThrownBy(() -> session.evaluate("return 1;")).isInstanceOf(SessionCrashException.class);
    }

    @Test
    void deadBrowserIsNotAlive() {
        when(driver.getWindowHandle()).thenThrow(new WebDriverException("chrome not reachable"));

        assertThat(session.isAlive()).isFalse();
    }

    @Test
    void closeQuitsOnce() {
        session.close();
        session.close();

        verify(driver, times(1)).quit();
        assertThat(session.isAlive()).isFalse();
    }
}
