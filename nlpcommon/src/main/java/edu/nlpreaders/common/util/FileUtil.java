package edu.nlpreaders.common.util;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

public class FileUtil
{
    static public List<File> getFiles(File dir, String regex)
    {
        return getFiles(dir, Pattern.compile(regex));
    }

    /**
     * Collects the files under dir whose name matches the pattern, in sorted
     * path order. Hidden directories are skipped. If dir is a regular file it
     * is returned as long as its name matches.
     */
    static public List<File> getFiles(File dir, Pattern pattern)
    {
        List<File> files = new ArrayList<File>();
        if (!dir.isDirectory())
        {
            if (dir.isFile() && pattern.matcher(dir.getName()).matches())
                files.add(dir);
            return files;
        }

        File[] children = dir.listFiles();
        if (children==null)
            return files;
        Arrays.sort(children);

        for (File file:children)
        {
            if (file.isDirectory())
            {
                if (file.getName().startsWith("."))
                    continue;
                files.addAll(getFiles(file, pattern));
            }
            else if (pattern.matcher(file.getName()).matches())
                files.add(file);
        }
        return files;
    }
}
