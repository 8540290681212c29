package io.shotmatrix.automation;

import io.appium.java_client.AppiumBy;
import io.appium.java_client.AppiumDriver;
import io.appium.java_client.android.AndroidDriver;
import io.appium.java_client.android.options.UiAutomator2Options;
import io.appium.java_client.ios.IOSDriver;
import io.appium.java_client.ios.options.XCUITestOptions;
import io.appium.java_client.remote.SupportsRotation;
import io.appium.java_client.remote.options.BaseOptions;
import io.shotmatrix.config.Selector;
import io.shotmatrix.error.ActionException;
import io.shotmatrix.error.ProvisioningException;
import io.shotmatrix.runtime.CancellationToken;
import org.openqa.selenium.By;
import org.openqa.selenium.ScreenOrientation;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Opens XCUITest or UiAutomator2 sessions through the Appium Java client.
 */
public final class AppiumSessionProvider implements SessionProvider {
    private static final Logger log = LoggerFactory.getLogger(AppiumSessionProvider.class);

    @Override
    public AutomationSession open(URI serverUrl, SessionCapabilities capabilities, CancellationToken token) {
        token.throwIfCancelled();
        URL url;
        try {
            url = serverUrl.toURL();
        } catch (MalformedURLException e) {
            throw new ProvisioningException("Invalid automation server URL: " + serverUrl, e);
        }
        try {
            AppiumDriver driver;
            if (capabilities instanceof IosCapabilities ios) {
                driver = new IOSDriver(url, iosOptions(ios));
            } else if (capabilities instanceof AndroidCapabilities android) {
                driver = new AndroidDriver(url, androidOptions(android));
            } else {
                throw new ProvisioningException("Unsupported capabilities type: " + capabilities.getClass().getSimpleName());
            }
            driver.manage().timeouts().implicitlyWait(Duration.ZERO);
            log.debug("Session {} opened on {}", driver.getSessionId(), serverUrl);
            return new AppiumSession(driver);
        } catch (WebDriverException e) {
            throw new ProvisioningException("Failed to open automation session on " + serverUrl + ": "
                    + firstLine(e.getMessage()), e);
        }
    }

    static XCUITestOptions iosOptions(IosCapabilities caps) {
        XCUITestOptions options = new XCUITestOptions()
                .setDeviceName(caps.deviceName())
                .setApp(caps.app())
                .setNoReset(true)
                .setNewCommandTimeout(Duration.ofSeconds(300));
        if (caps.udid() != null) {
            options.setUdid(caps.udid());
        }
        if (caps.platformVersion() != null) {
            options.setPlatformVersion(caps.platformVersion());
        }
        if (caps.locale() != null) {
            options.setCapability("language", caps.locale());
            options.setCapability("locale", caps.locale());
        }
        if (caps.wdaLocalPort() > 0) {
            // WebDriverAgent defaults to 8100 on every simulator.
            options.setWdaLocalPort(caps.wdaLocalPort());
        }
        options.setCapability("autoAcceptAlerts", true);
        options.setCapability("wdaStartupRetries", 3);
        options.setCapability("wdaStartupRetryInterval", 5000);
        applyExtras(options, caps.extras());
        return options;
    }

    static UiAutomator2Options androidOptions(AndroidCapabilities caps) {
        UiAutomator2Options options = new UiAutomator2Options()
                .setDeviceName(caps.deviceName())
                .setApp(caps.app())
                .setNoReset(true)
                .setNewCommandTimeout(Duration.ofSeconds(300));
        if (caps.avd() != null) {
            options.setAvd(caps.avd());
        }
        if (caps.udid() != null) {
            options.setUdid(caps.udid());
        }
        if (caps.platformVersion() != null) {
            options.setPlatformVersion(caps.platformVersion());
        }
        if (caps.locale() != null) {
            options.setCapability("language", caps.locale());
            options.setCapability("locale", caps.locale());
        }
        if (caps.systemPort() > 0) {
            options.setSystemPort(caps.systemPort());
        }
        options.setCapability("autoGrantPermissions", true);
        options.setCapability("adbExecTimeout", 60_000);
        options.setCapability("androidInstallTimeout", 300_000);
        applyExtras(options, caps.extras());
        return options;
    }

    private static void applyExtras(BaseOptions<?> options, Map<String, Object> extras) {
        for (Map.Entry<String, Object> entry : extras.entrySet()) {
            options.setCapability(entry.getKey(), entry.getValue());
        }
    }

    static By toBy(Selector selector) {
        return switch (selector.strategy()) {
            case ACCESSIBILITY_ID -> AppiumBy.accessibilityId(selector.value());
            case IOS_CLASS_CHAIN -> AppiumBy.iOSClassChain(selector.value());
            case ANDROID_UIAUTOMATOR -> AppiumBy.androidUIAutomator(selector.value());
            case XPATH -> By.xpath(selector.value());
            case ID -> By.id(selector.value());
        };
    }

    private static String firstLine(String message) {
        if (message == null) {
            return "";
        }
        int newline = message.indexOf('\n');
        return newline < 0 ? message : message.substring(0, newline);
    }

    private static final class AppiumSession implements AutomationSession {
        private final AppiumDriver driver;

        private AppiumSession(AppiumDriver driver) {
            this.driver = driver;
        }

        @Override
        public Optional<AutomationElement> findNow(Selector selector) {
            try {
                List<WebElement> found = driver.findElements(toBy(selector));
                for (WebElement element : found) {
                    if (element.isDisplayed()) {
                        AutomationElement hit = () -> clickElement(element, selector);
                        return Optional.of(hit);
                    }
                }
                return Optional.empty();
            } catch (WebDriverException e) {
                log.debug("Lookup {} failed: {}", selector.describe(), firstLine(e.getMessage()));
                return Optional.empty();
            }
        }

        @Override
        public void rotate(Orientation orientation) {
            if (!(driver instanceof SupportsRotation rotating)) {
                throw new ActionException("Driver does not support rotation");
            }
            try {
                rotating.rotate(orientation == Orientation.LANDSCAPE ? ScreenOrientation.LANDSCAPE : ScreenOrientation.PORTRAIT);
            } catch (WebDriverException e) {
                throw new ActionException("Failed to rotate to " + orientation.key() + ": " + firstLine(e.getMessage()), e);
            }
        }

        @Override
        public String pageSource() {
            return driver.getPageSource();
        }

        @Override
        public void close() {
            driver.quit();
        }

        private static void clickElement(WebElement element, Selector selector) {
            try {
                element.click();
            } catch (WebDriverException e) {
                throw new ActionException("Failed to tap " + selector.describe() + ": " + firstLine(e.getMessage()), e);
            }
        }
    }
}
