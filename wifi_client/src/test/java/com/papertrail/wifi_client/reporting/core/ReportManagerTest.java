package com.papertrail.wifi_client.reporting.core;

import com.papertrail.wifi_client.logging.LoggerFactory;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Arrays;
import java.util.Collections;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@RunWith(org.junit.runners.JUnit4.class)
public class ReportManagerTest {

    @Mock
    private IReportProvider first;
    @Mock
    private IReportProvider second;

    private ReportManager reportManager;

    @Before
    public void setup() {
        MockitoAnnotations.openMocks(this);
        when(first.getProviderName()).thenReturn("First");
        when(second.getProviderName()).thenReturn("Second");
        reportManager = new ReportManager(LoggerFactory.createLogger());
    }

    @Test
    public void testOnlyInitializedProvidersAreAdded() {
        when(first.initialize()).thenReturn(true);
        when(second.initialize()).thenReturn(false);

        reportManager.addProvider(first);
        reportManager.addProvider(second);

        Assert.assertEquals(Collections.singletonList("First"), reportManager.getProviderNames());
    }

    @Test
    public void testReportsReachEnabledProvidersFiltered() {
        when(first.initialize()).thenReturn(true);
        when(first.isEnabled()).thenReturn(true);
        when(second.initialize()).thenReturn(true);
        when(second.isEnabled()).thenReturn(false);
        reportManager.addProvider(first);
        reportManager.addProvider(second);

        reportManager.report(new ReportData.Builder().message("psk=abc").level(ReportLevel.WARNING));
        reportManager.shutdown();

        ArgumentCaptor<ReportData> captor = ArgumentCaptor.forClass(ReportData.class);
        verify(first, timeout(2000)).report(captor.capture());
        Assert.assertEquals("psk=" + DataFilter.FILTERED, captor.getValue().getMessage());
        verify(second, never()).report(any());
        verify(first).close();
    }

    @Test
    public void testFailingProviderDoesNotBlockOthers() {
        when(first.initialize()).thenReturn(true);
        when(first.isEnabled()).thenReturn(true);
        when(second.initialize()).thenReturn(true);
        when(second.isEnabled()).thenReturn(true);
        doThrow(new IllegalStateException("offline")).when(first).report(any());
        reportManager.addProvider(first);
        reportManager.addProvider(second);

        reportManager.report(new ReportData.Builder().message("hotspot timeout"));

        verify(second, timeout(2000)).report(any());
        reportManager.shutdown();
    }

    @Test
    public void testRemoveProviderClosesIt() {
        when(first.initialize()).thenReturn(true);
        when(second.initialize()).thenReturn(true);
        reportManager.addProvider(first);
        reportManager.addProvider(second);

        reportManager.removeProvider("First");

        Assert.assertEquals(Arrays.asList("Second"), reportManager.getProviderNames());
        verify(first).close();
        reportManager.shutdown();
    }
}
