package io.shotmatrix.automation;

public interface AutomationElement {
    void click();
}
